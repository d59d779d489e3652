package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.CastExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.EventNode;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.OutputBinding;
import co.fanki.blueprintmcp.analysis.domain.ast.SourceLocation;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.analysis.domain.ast.TraversalBoundaryNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableDeclaration;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.graph.domain.BlueprintGraph;
import co.fanki.blueprintmcp.graph.domain.BlueprintGraph.Connection;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.graph.domain.NodeKinds;
import co.fanki.blueprintmcp.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reconstructs the logical tree of a {@link BlueprintGraph}.
 *
 * <p>Traversal is driven by execution flow: starting at every entry node
 * it dispatches each reached node to its processor and follows the exec
 * output the processor points at. Data inputs are resolved on demand by
 * walking back to the producing output pin. A value read by more than
 * one input is extracted into a single temporary, declared before the
 * outermost enclosing statement that can see everything the value reads;
 * a value read once is inlined.</p>
 *
 * <p>Analysis never throws on bad data. Cycles and exhausted budgets
 * become {@link TraversalBoundaryNode}s, unresolvable values become
 * {@link UnsupportedExpression}s, unknown nodes are handed to the
 * fallback processor. Only a processor breaking its contract raises a
 * {@link ProcessorContractException}.</p>
 *
 * <p>The analyzer itself is stateless; every entry gets a fresh
 * {@link AnalysisContext}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphAnalyzer.class);

    /** Default node visit budget per entry node. */
    public static final int DEFAULT_MAX_NODE_VISITS = 10_000;

    /** Inputs never passed as call arguments. */
    private static final Set<String> IMPLICIT_INPUTS = Set.of(
            "self", "WorldContextObject", "__WorldContext");

    private final ProcessorRegistry registry;
    private final int maxNodeVisits;

    /**
     * Creates an analyzer.
     *
     * @param theRegistry the processors to dispatch nodes to
     * @param theMaxNodeVisits the node visit budget per entry node
     */
    public GraphAnalyzer(final ProcessorRegistry theRegistry,
            final int theMaxNodeVisits) {
        registry = Preconditions.requireNonNull(theRegistry,
                "The processor registry cannot be null");
        maxNodeVisits = Preconditions.requirePositive(theMaxNodeVisits,
                "The node visit budget must be positive");
    }

    public ProcessorRegistry registry() {
        return registry;
    }

    /**
     * Analyzes a graph.
     *
     * @param graph the graph
     * @return one statement per entry node, in graph order
     */
    public List<Statement> analyze(final BlueprintGraph graph) {
        Preconditions.requireNonNull(graph, "The graph cannot be null");

        final Map<String, Integer> usage = countPinUsage(graph);
        final List<Statement> roots = new ArrayList<>();
        for (final GraphNode entry : graph.entryNodes()) {
            LOG.debug("Analyzing entry {}", entry);
            final AnalysisContext context = new AnalysisContext(graph, usage,
                    maxNodeVisits);
            roots.add(analyzeEntry(context, entry));
        }

        LOG.info("Analyzed '{}': {} entry nodes", graph.graphName(),
                roots.size());
        return List.copyOf(roots);
    }

    private Statement analyzeEntry(final AnalysisContext context,
            final GraphNode entry) {
        final List<Statement> statements = new ArrayList<>();
        walk(context, entry, statements);

        if (NodeKinds.isEntryKind(entry.kind()) && statements.size() == 1
                && statements.get(0) instanceof EventNode event) {
            return event;
        }
        return new EventNode(entry.name(), List.of(),
                new ExecutionBlock(statements), context.locationOf(entry));
    }

    // -- Execution flow ---------------------------------------------------

    /**
     * Follows the exec links of a pin without opening a scope.
     *
     * @param context the traversal state
     * @param pin the exec output to follow, may be null
     * @return the statements reached, empty when the pin is unlinked
     */
    public ExecutionBlock followExecution(final AnalysisContext context,
            final GraphPin pin) {
        final List<Statement> statements = new ArrayList<>();
        if (pin != null) {
            for (final Connection next : execSuccessors(context, pin)) {
                walk(context, next.node(), statements);
            }
        }
        return new ExecutionBlock(statements);
    }

    /**
     * Follows the exec links of a pin inside a new scope.
     *
     * @param context the traversal state
     * @param pin the exec output to follow, may be null
     * @return the statements reached
     */
    public ExecutionBlock traverseBlock(final AnalysisContext context,
            final GraphPin pin) {
        return traverseBlock(context, pin, Map.of(), List.of());
    }

    /**
     * Follows the exec links of a pin inside a new scope holding the
     * given bindings, with leading statements placed first in the block.
     *
     * @param context the traversal state
     * @param pin the exec output to follow, may be null
     * @param bindings pin keys bound for the extent of the block
     * @param leading statements opening the block, e.g. declarations
     * @return the statements reached, after the leading ones
     */
    public ExecutionBlock traverseBlock(final AnalysisContext context,
            final GraphPin pin, final Map<String, Expression> bindings,
            final List<Statement> leading) {
        final int mark = context.memoizationMark();
        context.scopes().enterScope();
        try {
            bindings.forEach(context.scopes()::registerVariable);
            final List<Statement> statements = new ArrayList<>(leading);
            statements.addAll(followExecution(context, pin).statements());
            return new ExecutionBlock(statements);
        } finally {
            context.scopes().leaveScope();
            context.forgetMemoizedSince(mark);
        }
    }

    /** Processes a chain of nodes, appending what it produces. */
    private void walk(final AnalysisContext context, final GraphNode first,
            final List<Statement> into) {
        final List<GraphNode> entered = new ArrayList<>();
        GraphNode current = first;
        try {
            while (current != null) {
                if (!context.enterPath(current)) {
                    into.add(new TraversalBoundaryNode(
                            TraversalBoundaryNode.Reason.CYCLE,
                            current.name(), context.locationOf(current)));
                    return;
                }
                entered.add(current);
                if (!context.consumeVisit()) {
                    LOG.warn("Node visit budget exhausted at {}", current);
                    into.add(new TraversalBoundaryNode(
                            TraversalBoundaryNode.Reason.BUDGET_EXHAUSTED,
                            current.name(), context.locationOf(current)));
                    return;
                }

                final NodeProcessingResult result = processStatement(
                        context, current, into);
                final GraphPin next = continuation(context, current, result);
                if (next == null) {
                    return;
                }

                final List<Connection> successors =
                        execSuccessors(context, next);
                if (successors.size() == 1) {
                    current = successors.get(0).node();
                } else {
                    for (final Connection successor : successors) {
                        walk(context, successor.node(), into);
                    }
                    current = null;
                }
            }
        } finally {
            for (int i = entered.size() - 1; i >= 0; i--) {
                context.leavePath(entered.get(i));
            }
        }
    }

    private NodeProcessingResult processStatement(
            final AnalysisContext context, final GraphNode node,
            final List<Statement> into) {
        final NodeProcessor processor = registry.resolve(node);
        LOG.debug("Dispatching {} to {}", node,
                processor.getClass().getSimpleName());

        context.beginStatement(!NodeKinds.isEntryKind(node.kind()));
        final NodeProcessingResult result;
        final List<Statement> prelude;
        try {
            result = processor.processStatement(this, context, node);
        } finally {
            prelude = context.endStatement();
        }

        if (result == null) {
            throw new ProcessorContractException(
                    processor.getClass().getSimpleName()
                            + " returned no result for " + node);
        }
        into.addAll(prelude);
        if (result.statement() != null) {
            into.add(result.statement());
        }
        return result;
    }

    private static GraphPin continuation(final AnalysisContext context,
            final GraphNode node, final NodeProcessingResult result) {
        final GraphPin pending = context.takePendingContinuationPin();
        return switch (result.flow()) {
            case TERMINATE -> null;
            case CONTINUE_FROM -> result.continuation();
            case FOLLOW_DEFAULT -> pending != null ? pending
                    : defaultExecOutput(node);
        };
    }

    /**
     * Returns the exec output traversal follows by default: the then pin,
     * else the first linked exec output.
     *
     * @param node the node
     * @return the pin, or null when the node has no linked exec output
     */
    public static GraphPin defaultExecOutput(final GraphNode node) {
        final Optional<GraphPin> then = PinAliases.find(node,
                PinAliases.Role.THEN);
        if (then.isPresent()) {
            return then.get();
        }
        for (final GraphPin pin : node.execOutputs()) {
            if (pin.linked()) {
                return pin;
            }
        }
        return null;
    }

    private static List<Connection> execSuccessors(
            final AnalysisContext context, final GraphPin pin) {
        final List<Connection> successors = new ArrayList<>();
        for (final Connection connection : context.graph().connections(pin)) {
            if (connection.pin().exec() && connection.pin().input()) {
                successors.add(connection);
            }
        }
        return successors;
    }

    /**
     * Produces the fallback statement of a node.
     *
     * @param context the traversal state
     * @param node the node
     * @return the fallback result
     */
    public NodeProcessingResult fallbackStatement(
            final AnalysisContext context, final GraphNode node) {
        return registry.fallback().processStatement(this, context, node);
    }

    // -- Data flow --------------------------------------------------------

    /**
     * Resolves the value flowing into an input pin.
     *
     * @param context the traversal state
     * @param node the node owning the pin
     * @param input the input pin
     * @return the value, never null
     */
    public Expression resolveInput(final AnalysisContext context,
            final GraphNode node, final GraphPin input) {
        if (!input.linked()) {
            if (input.danglingLinks()) {
                return new UnsupportedExpression("input '" + input.pinName()
                        + "' is linked to a missing pin", null,
                        context.locationOf(node));
            }
            return literal(context, node, input);
        }

        for (final Connection source : context.graph().connections(input)) {
            if (source.pin().output() && !source.pin().exec()) {
                return resolveOutput(context, source.node(), source.pin());
            }
        }
        return new UnsupportedExpression("input '" + input.pinName()
                + "' has no data source", null, context.locationOf(node));
    }

    /**
     * Resolves the value of a named input pin.
     *
     * @param context the traversal state
     * @param node the node
     * @param pinName the input pin name
     * @return the value, an unsupported marker when the pin is missing
     */
    public Expression resolveInput(final AnalysisContext context,
            final GraphNode node, final String pinName) {
        return node.findInput(pinName)
                .map(pin -> resolveInput(context, node, pin))
                .orElseGet(() -> new UnsupportedExpression(
                        "missing input pin '" + pinName + "'", node.kind(),
                        context.locationOf(node)));
    }

    /**
     * Resolves the value of an output pin: structural bindings first,
     * then scoped variables, then memoized values, then the producing
     * node's processor.
     *
     * @param context the traversal state
     * @param producer the node owning the output
     * @param output the output pin
     * @return the value, never null
     */
    public Expression resolveOutput(final AnalysisContext context,
            final GraphNode producer, final GraphPin output) {
        final String key = pinKey(producer, output);

        final Optional<Expression> known = context.known(key);
        if (known.isPresent()) {
            return known.get();
        }

        if (!context.startResolving(key)) {
            return new UnsupportedExpression("circular data dependency"
                    + " through " + producer.name() + "."
                    + output.pinName(), producer.kind(),
                    context.locationOf(producer));
        }

        final Expression value;
        final int floor;
        context.startDependencies();
        try {
            value = processExpression(context, producer, output);
        } finally {
            floor = context.finishDependencies();
            context.finishResolving(key);
        }

        if (context.usageCount(key) > 1 && extractable(value)) {
            final Optional<Expression> extracted = extract(context, producer,
                    output, key, value, floor);
            if (extracted.isPresent()) {
                return extracted.get();
            }
        }
        context.dependsOn(floor);
        context.memoize(key, value, floor);
        return value;
    }

    private Expression processExpression(final AnalysisContext context,
            final GraphNode node, final GraphPin output) {
        final NodeProcessor processor = registry.resolve(node);
        final Expression value = processor.processExpression(this, context,
                node, output);
        if (value == null) {
            throw new ProcessorContractException(
                    processor.getClass().getSimpleName()
                            + " returned no value for " + node + "."
                            + output.pinName());
        }
        return value;
    }

    private static boolean extractable(final Expression value) {
        return value instanceof FunctionCallExpression
                || value instanceof CastExpression;
    }

    /**
     * Declares a value read by several inputs once, before the outermost
     * statement being produced that sees everything the value reads, and
     * binds the pin to the temporary in that statement's scope so reads
     * from sibling blocks share it.
     */
    private static Optional<Expression> extract(
            final AnalysisContext context, final GraphNode producer,
            final GraphPin output, final String key, final Expression value,
            final int floor) {
        if (!context.canDeclare(floor)) {
            return Optional.empty();
        }
        final SourceLocation location = context.locationOf(producer);
        final String name = context.allocateName(temporaryName(producer));
        final int depth = context.addToOutermostPrelude(
                new VariableDeclaration(name, output.typeName(), value,
                        VariableDeclaration.Kind.TEMPORARY, location),
                floor);

        final Expression reference = new VariableGetExpression(name, false,
                location);
        context.scopes().registerVariable(key, reference, depth);
        context.dependsOn(depth);
        LOG.debug("Extracted {} read {} times into {}", key,
                context.usageCount(key), name);
        return Optional.of(reference);
    }

    private static String temporaryName(final GraphNode producer) {
        final String function = producer.memberText("FunctionReference",
                "MemberName");
        final String base = function != null
                ? function.replace("BP_", "").replace("K2_", "")
                : producer.kind().replace("K2Node_", "");
        return "temp_" + base.toLowerCase(Locale.ROOT);
    }

    private static LiteralExpression literal(final AnalysisContext context,
            final GraphNode node, final GraphPin pin) {
        return new LiteralExpression(pin.defaultValue(),
                LiteralExpression.LiteralType.fromPinCategory(
                        pin.category(), pin.subCategoryObject()),
                context.locationOf(node));
    }

    // -- Helpers for processors -------------------------------------------

    /**
     * Resolves the visible data inputs of a node as call arguments, in
     * pin order.
     *
     * @param context the traversal state
     * @param node the node
     * @param excluded input names to leave out, besides self and the
     *      world context
     * @return the arguments
     */
    public List<Argument> resolveArguments(final AnalysisContext context,
            final GraphNode node, final Set<String> excluded) {
        final List<Argument> arguments = new ArrayList<>();
        for (final GraphPin pin : node.dataInputs()) {
            if (IMPLICIT_INPUTS.contains(pin.pinName())
                    || excluded.contains(pin.pinName())) {
                continue;
            }
            arguments.add(new Argument(pin.pinName(),
                    resolveInput(context, node, pin)));
        }
        return arguments;
    }

    /**
     * Resolves the object a call is made on.
     *
     * @param context the traversal state
     * @param node the node
     * @param pinName the target input, usually {@code self}
     * @return the target, or null when the call is made on self
     */
    public Expression resolveTarget(final AnalysisContext context,
            final GraphNode node, final String pinName) {
        final Optional<GraphPin> pin = node.findInput(pinName);
        if (pin.isEmpty()
                || (!pin.get().linked() && !pin.get().danglingLinks())) {
            return null;
        }
        return resolveInput(context, node, pin.get());
    }

    /**
     * Binds the linked data outputs of an impure node to local names in
     * the current scope, so later reads refer to the produced values.
     *
     * @param context the traversal state
     * @param node the node
     * @param functionName the name used for a {@code ReturnValue} output
     * @return the bindings, in pin order
     */
    public List<OutputBinding> bindOutputs(final AnalysisContext context,
            final GraphNode node, final String functionName) {
        final List<OutputBinding> bindings = new ArrayList<>();
        for (final GraphPin pin : node.dataOutputs()) {
            if (!pin.linked()) {
                continue;
            }
            final String base = "ReturnValue".equals(pin.pinName())
                    ? identifier(functionName.replace("K2_", "")) + "_Result"
                    : identifier(pin.pinName());
            final String name = context.allocateName(base);
            context.scopes().registerVariable(pinKey(node, pin),
                    new VariableGetExpression(name, false,
                            context.locationOf(node)));
            bindings.add(new OutputBinding(pin.pinName(), name,
                    pin.typeName()));
        }
        return bindings;
    }

    /**
     * Returns the key identifying a pin across the graph.
     *
     * @param node the owning node
     * @param pin the pin
     * @return {@code nodeGuid:pinId}
     */
    public static String pinKey(final GraphNode node, final GraphPin pin) {
        return node.guid() + ":" + pin.pinId();
    }

    /**
     * Turns a pin or type name into an identifier.
     *
     * @param name the name
     * @return the name without characters invalid in identifiers
     */
    public static String identifier(final String name) {
        final String cleaned = name.replaceAll("[^A-Za-z0-9_]", "");
        return cleaned.isEmpty() ? "value" : cleaned;
    }

    /**
     * Counts, for every data output, the distinct input pins it feeds.
     * Links are read from both ends.
     *
     * @param graph the graph
     * @return the count per output pin key
     */
    static Map<String, Integer> countPinUsage(final BlueprintGraph graph) {
        final Map<String, Set<String>> consumers = new HashMap<>();
        for (final GraphNode node : graph.nodes()) {
            for (final GraphPin pin : node.pins()) {
                if (pin.exec()) {
                    continue;
                }
                for (final Connection remote : graph.connections(pin)) {
                    if (pin.output() && remote.pin().input()) {
                        consumers.computeIfAbsent(pinKey(node, pin),
                                k -> new LinkedHashSet<>()).add(remote.key());
                    } else if (pin.input() && remote.pin().output()) {
                        consumers.computeIfAbsent(remote.key(),
                                k -> new LinkedHashSet<>())
                                .add(pinKey(node, pin));
                    }
                }
            }
        }
        final Map<String, Integer> counts = new HashMap<>();
        consumers.forEach((key, set) -> counts.put(key, set.size()));
        return counts;
    }

}
