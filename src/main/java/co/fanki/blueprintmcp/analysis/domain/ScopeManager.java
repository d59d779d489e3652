package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Stack of lexical scopes binding pin keys to resolved expressions.
 *
 * <p>The root scope is created with the manager and is never popped.
 * Bindings go to the innermost scope; lookups walk from the innermost
 * scope outwards, so inner bindings shadow outer ones and disappear
 * when their scope is left.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScopeManager {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScopeManager.class);

    /** Depth of the root scope. */
    public static final int ROOT_DEPTH = 1;

    private final Deque<Map<String, Expression>> scopes = new ArrayDeque<>();

    /** Creates a manager holding only the root scope. */
    public ScopeManager() {
        scopes.push(new HashMap<>());
    }

    /** Pushes a new empty scope. */
    public void enterScope() {
        scopes.push(new HashMap<>());
    }

    /**
     * Pops the innermost scope. The root scope stays in place.
     *
     * @return false when called on the root scope
     */
    public boolean leaveScope() {
        if (scopes.size() == 1) {
            LOG.warn("leaveScope called on the root scope, ignoring");
            return false;
        }
        scopes.pop();
        return true;
    }

    /**
     * Binds a pin key in the innermost scope.
     *
     * @param pinKey the {@code nodeGuid:pinId} key
     * @param expression the resolved expression
     */
    public void registerVariable(final String pinKey,
            final Expression expression) {
        Preconditions.requireNonNull(pinKey, "The pin key cannot be null");
        Preconditions.requireNonNull(expression,
                "The expression cannot be null");
        scopes.peek().put(pinKey, expression);
    }

    /**
     * Binds a pin key in an enclosing scope that is still open.
     *
     * @param pinKey the {@code nodeGuid:pinId} key
     * @param expression the resolved expression
     * @param depth the scope depth, {@link #ROOT_DEPTH} for the root
     */
    public void registerVariable(final String pinKey,
            final Expression expression, final int depth) {
        Preconditions.requireNonNull(pinKey, "The pin key cannot be null");
        Preconditions.requireNonNull(expression,
                "The expression cannot be null");
        Preconditions.require(depth >= ROOT_DEPTH && depth <= scopes.size(),
                "No open scope at depth " + depth);
        final Iterator<Map<String, Expression>> it =
                scopes.descendingIterator();
        for (int i = ROOT_DEPTH; i < depth; i++) {
            it.next();
        }
        it.next().put(pinKey, expression);
    }

    /**
     * Looks a pin key up, innermost scope first.
     *
     * @param pinKey the {@code nodeGuid:pinId} key
     * @return the first binding found
     */
    public Optional<Expression> lookupVariable(final String pinKey) {
        final Iterator<Map<String, Expression>> it = scopes.iterator();
        while (it.hasNext()) {
            final Expression found = it.next().get(pinKey);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the depth of the scope a pin key is bound in, innermost
     * binding first.
     *
     * @param pinKey the {@code nodeGuid:pinId} key
     * @return the depth, zero when the key is unbound
     */
    public int depthOf(final String pinKey) {
        int depth = scopes.size();
        for (final Map<String, Expression> scope : scopes) {
            if (scope.containsKey(pinKey)) {
                return depth;
            }
            depth--;
        }
        return 0;
    }

    /**
     * Returns the number of scopes, the root included.
     *
     * @return the depth, at least one
     */
    public int depth() {
        return scopes.size();
    }

}
