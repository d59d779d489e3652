package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.PinAliases;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopVariableExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableDeclaration;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The loop macros: {@code ForEachLoop}, {@code ForLoop},
 * {@code WhileLoop} and their {@code WithBreak} variants.
 *
 * <p>The loop body is traversed in its own scope, where the element and
 * index outputs are bound to loop variables. Once the body is folded
 * into the loop node, traversal resumes at {@code Completed}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LoopMacroProcessor implements NodeProcessor {

    private final LoopNode.Kind kind;

    /**
     * Creates a processor for one kind of loop.
     *
     * @param theKind the loop kind
     */
    public LoopMacroProcessor(final LoopNode.Kind theKind) {
        kind = Preconditions.requireNonNull(theKind,
                "The loop kind cannot be null");
    }

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final Expression source;
        Expression bound = null;
        final Map<String, Expression> bindings = new LinkedHashMap<>();
        final List<VariableDeclaration> variables = new ArrayList<>();

        switch (kind) {
            case FOR_EACH -> {
                source = analyzer.resolveInput(context, node, "Array");
                declare(context, node, "Array Element", "ArrayElement",
                        LoopVariableExpression.Role.ELEMENT, bindings,
                        variables);
                declare(context, node, "Array Index", "ArrayIndex",
                        LoopVariableExpression.Role.INDEX, bindings,
                        variables);
            }
            case FOR -> {
                source = analyzer.resolveInput(context, node, "FirstIndex");
                bound = analyzer.resolveInput(context, node, "LastIndex");
                declare(context, node, "Index", "Index",
                        LoopVariableExpression.Role.INDEX, bindings,
                        variables);
            }
            default -> source = analyzer.resolveInput(context, node,
                    "Condition");
        }

        final ExecutionBlock body = analyzer.traverseBlock(context,
                PinAliases.find(node, PinAliases.Role.LOOP_BODY).orElse(null),
                bindings, List.of());
        final GraphPin completed = PinAliases.find(node,
                PinAliases.Role.COMPLETED).orElse(null);
        final LoopNode loop = new LoopNode(kind, source, bound, variables,
                body, context.locationOf(node));
        if (completed == null) {
            return NodeProcessingResult.terminal(loop);
        }
        context.setPendingContinuationPin(completed);
        return NodeProcessingResult.of(loop);
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        return new UnsupportedExpression("loop variable '"
                + output.pinName() + "' read outside its loop body",
                node.kind(), context.locationOf(node));
    }

    private static void declare(final AnalysisContext context,
            final GraphNode node, final String pinName, final String base,
            final LoopVariableExpression.Role role,
            final Map<String, Expression> bindings,
            final List<VariableDeclaration> variables) {
        final Optional<GraphPin> pin = node.findOutput(pinName);
        if (pin.isEmpty()) {
            return;
        }
        final String name = context.allocateName(base);
        variables.add(new VariableDeclaration(name, pin.get().typeName(),
                null, VariableDeclaration.Kind.LOOP,
                context.locationOf(node)));
        bindings.put(GraphAnalyzer.pinKey(node, pin.get()),
                new LoopVariableExpression(name, role,
                        context.locationOf(node)));
    }

}
