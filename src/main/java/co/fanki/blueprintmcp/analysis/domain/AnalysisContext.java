package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.SourceLocation;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.graph.domain.BlueprintGraph;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one traversal, from an entry node down.
 *
 * <p>A context is created per entry root and passed explicitly to every
 * processor; nothing here is shared between traversals, which is what
 * lets independent analyses run concurrently.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisContext {

    private final BlueprintGraph graph;
    private final Map<String, Integer> pinUsageCounts;
    private final ScopeManager scopes = new ScopeManager();

    /** Structural bindings, visible from every scope: event parameters. */
    private final Map<String, Expression> pinAstMap = new HashMap<>();

    /** Single-use values already resolved, with their insertion order. */
    private final Map<String, Expression> memoizationCache = new HashMap<>();
    private final Map<String, Integer> memoizationFloors = new HashMap<>();
    private final List<String> memoizationJournal = new ArrayList<>();

    /** One pending prelude per statement being produced, innermost first. */
    private final Deque<StatementFrame> scopePrelude = new ArrayDeque<>();

    /** Deepest scope read so far, per value being resolved. */
    private final Deque<int[]> dependencyFloors = new ArrayDeque<>();

    private final Set<String> executionPath = new HashSet<>();
    private final Set<String> resolving = new HashSet<>();
    private final Set<String> usedNames = new HashSet<>();

    private GraphPin pendingContinuationPin;
    private int remainingVisits;

    /**
     * Creates a context.
     *
     * @param theGraph the graph being analyzed
     * @param thePinUsageCounts consumers per output pin key
     * @param maxNodeVisits the node visit budget of this traversal
     */
    public AnalysisContext(final BlueprintGraph theGraph,
            final Map<String, Integer> thePinUsageCounts,
            final int maxNodeVisits) {
        graph = Preconditions.requireNonNull(theGraph,
                "The graph cannot be null");
        pinUsageCounts = Preconditions.requireNonNull(thePinUsageCounts,
                "The pin usage counts cannot be null");
        remainingVisits = Preconditions.requirePositive(maxNodeVisits,
                "The node visit budget must be positive");
    }

    public BlueprintGraph graph() {
        return graph;
    }

    public ScopeManager scopes() {
        return scopes;
    }

    /**
     * Returns where an AST node produced from a graph node comes from.
     *
     * @param node the graph node
     * @return the location, carrying the node's diagnostics
     */
    public SourceLocation locationOf(final GraphNode node) {
        return new SourceLocation(node.guid(), node.name(),
                node.diagnostics());
    }

    // -- Bindings ---------------------------------------------------------

    /**
     * Binds a pin structurally. Structural bindings win over scopes.
     *
     * @param pinKey the {@code nodeGuid:pinId} key
     * @param expression the expression the pin stands for
     */
    public void bindStructural(final String pinKey,
            final Expression expression) {
        pinAstMap.put(pinKey, expression);
    }

    public Optional<Expression> structural(final String pinKey) {
        return Optional.ofNullable(pinAstMap.get(pinKey));
    }

    public void memoize(final String pinKey, final Expression expression) {
        memoize(pinKey, expression, ScopeManager.ROOT_DEPTH);
    }

    /**
     * Remembers a resolved value together with the deepest scope it reads.
     *
     * @param pinKey the output pin key
     * @param expression the value
     * @param floor the deepest scope depth the value refers to
     */
    public void memoize(final String pinKey, final Expression expression,
            final int floor) {
        if (memoizationCache.put(pinKey, expression) == null) {
            memoizationJournal.add(pinKey);
        }
        memoizationFloors.put(pinKey, floor);
    }

    public Optional<Expression> memoized(final String pinKey) {
        return Optional.ofNullable(memoizationCache.get(pinKey));
    }

    /**
     * Looks up a value already known for an output pin: structural
     * bindings first, then scoped variables, then memoized values. A hit
     * is recorded as a dependency of the value being resolved.
     *
     * @param pinKey the output pin key
     * @return the known value
     */
    public Optional<Expression> known(final String pinKey) {
        final Optional<Expression> structural = structural(pinKey);
        if (structural.isPresent()) {
            return structural;
        }
        final Optional<Expression> scoped = scopes.lookupVariable(pinKey);
        if (scoped.isPresent()) {
            dependsOn(scopes.depthOf(pinKey));
            return scoped;
        }
        final Optional<Expression> memoized = memoized(pinKey);
        memoized.ifPresent(value -> dependsOn(
                memoizationFloors.get(pinKey)));
        return memoized;
    }

    /**
     * Returns a mark to later forget values memoized from here on.
     *
     * @return the mark
     */
    public int memoizationMark() {
        return memoizationJournal.size();
    }

    /**
     * Forgets values memoized after a mark. Called when a scope is left,
     * since those values may refer to names bound in that scope.
     *
     * @param mark a mark returned by {@link #memoizationMark()}
     */
    public void forgetMemoizedSince(final int mark) {
        while (memoizationJournal.size() > mark) {
            final String key = memoizationJournal.remove(
                    memoizationJournal.size() - 1);
            memoizationCache.remove(key);
            memoizationFloors.remove(key);
        }
    }

    /**
     * Returns how many input pins read an output pin.
     *
     * @param pinKey the output pin key
     * @return the consumer count, zero when unknown
     */
    public int usageCount(final String pinKey) {
        return pinUsageCounts.getOrDefault(pinKey, 0);
    }

    // -- Preludes ---------------------------------------------------------

    /** Opens the prelude of a statement about to be produced. */
    public void beginStatement() {
        beginStatement(true);
    }

    /**
     * Opens the prelude of a statement about to be produced.
     *
     * @param hostsDeclarations false when nothing may be declared before
     *      the statement, as for an entry whose statement is the root
     */
    public void beginStatement(final boolean hostsDeclarations) {
        scopePrelude.push(new StatementFrame(new ArrayList<>(),
                scopes.depth(), hostsDeclarations));
    }

    /**
     * Tells whether a statement is being produced, so a prelude exists.
     *
     * @return true inside a statement
     */
    public boolean inStatement() {
        return !scopePrelude.isEmpty();
    }

    /**
     * Queues a statement to be placed right before the statement being
     * produced.
     *
     * @param statement the statement, typically a temporary declaration
     */
    public void addToPrelude(final Statement statement) {
        Preconditions.require(!scopePrelude.isEmpty(),
                "No statement is being produced");
        scopePrelude.peek().prelude().add(statement);
    }

    /**
     * Tells whether an open statement can host a declaration reading
     * scopes down to a depth.
     *
     * @param floor the deepest scope depth the declared value reads
     * @return true when {@link #addToOutermostPrelude} would succeed
     */
    public boolean canDeclare(final int floor) {
        return host(floor) != null;
    }

    /**
     * Queues a declaration before the outermost statement being produced
     * whose scope sees every name the declared value reads.
     *
     * @param declaration the declaration
     * @param floor the deepest scope depth the declared value reads
     * @return the scope depth of the chosen statement
     */
    public int addToOutermostPrelude(final Statement declaration,
            final int floor) {
        final StatementFrame frame = host(floor);
        Preconditions.require(frame != null,
                "No statement can host a declaration at depth " + floor);
        frame.prelude().add(declaration);
        return frame.scopeDepth();
    }

    private StatementFrame host(final int floor) {
        final Iterator<StatementFrame> outermostFirst =
                scopePrelude.descendingIterator();
        while (outermostFirst.hasNext()) {
            final StatementFrame frame = outermostFirst.next();
            if (frame.hostsDeclarations() && frame.scopeDepth() >= floor) {
                return frame;
            }
        }
        return null;
    }

    /**
     * Closes the prelude of the statement just produced.
     *
     * @return the queued statements, in order
     */
    public List<Statement> endStatement() {
        return scopePrelude.pop().prelude();
    }

    // -- Dependencies -----------------------------------------------------

    /** Starts recording the scopes read by a value about to be resolved. */
    public void startDependencies() {
        dependencyFloors.push(new int[] {ScopeManager.ROOT_DEPTH});
    }

    /**
     * Records that the value being resolved reads a scope.
     *
     * @param depth the scope depth read
     */
    public void dependsOn(final int depth) {
        final int[] floor = dependencyFloors.peek();
        if (floor != null && depth > floor[0]) {
            floor[0] = depth;
        }
    }

    /**
     * Stops recording for the value just resolved.
     *
     * @return the deepest scope depth it reads
     */
    public int finishDependencies() {
        return dependencyFloors.pop()[0];
    }

    // -- Traversal guards -------------------------------------------------

    /**
     * Puts a node on the current execution path.
     *
     * @param node the node
     * @return false when the node already is on the path, a cycle
     */
    public boolean enterPath(final GraphNode node) {
        return executionPath.add(node.guid());
    }

    public void leavePath(final GraphNode node) {
        executionPath.remove(node.guid());
    }

    /**
     * Spends one node visit.
     *
     * @return false when the budget is exhausted
     */
    public boolean consumeVisit() {
        if (remainingVisits <= 0) {
            return false;
        }
        remainingVisits--;
        return true;
    }

    /**
     * Marks a pin as being resolved.
     *
     * @param pinKey the output pin key
     * @return false when the pin is already being resolved, a data cycle
     */
    public boolean startResolving(final String pinKey) {
        return resolving.add(pinKey);
    }

    public void finishResolving(final String pinKey) {
        resolving.remove(pinKey);
    }

    // -- Names and continuation -------------------------------------------

    /**
     * Reserves a variable name, suffixing {@code _1}, {@code _2} and so on
     * when the base name is taken.
     *
     * @param base the preferred name
     * @return a name not returned before by this context
     */
    public String allocateName(final String base) {
        String name = base;
        int counter = 1;
        while (!usedNames.add(name)) {
            name = base + "_" + counter;
            counter++;
        }
        return name;
    }

    /**
     * Tells traversal where to resume after the node being processed,
     * once its own sub-traversals are done. Processors set it right before
     * returning a result that follows the default flow.
     *
     * @param pin the pin to resume at
     */
    public void setPendingContinuationPin(final GraphPin pin) {
        pendingContinuationPin = pin;
    }

    /**
     * Returns and clears the pending continuation.
     *
     * @return the pin, or null when none was set
     */
    public GraphPin takePendingContinuationPin() {
        final GraphPin pin = pendingContinuationPin;
        pendingContinuationPin = null;
        return pin;
    }

    /** The prelude of one statement and the scope it was opened in. */
    private record StatementFrame(List<Statement> prelude, int scopeDepth,
            boolean hostsDeclarations) {
    }

}
