package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * A loop with its iteration source, loop variables and body.
 *
 * <p>For {@link Kind#FOR_EACH} the source is the collection, for
 * {@link Kind#WHILE} the condition, and for {@link Kind#FOR} the first
 * index, with {@code bound} holding the last one.</p>
 *
 * @param kind the loop kind
 * @param source the iteration source
 * @param bound the upper bound of a counted loop, null otherwise
 * @param variables the variables the loop declares
 * @param body the loop body
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LoopNode(Kind kind, Expression source, Expression bound,
        List<VariableDeclaration> variables, ExecutionBlock body,
        SourceLocation location) implements Statement {

    public LoopNode {
        variables = List.copyOf(variables);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitLoop(this);
    }

    /** The loop flavors. */
    public enum Kind {
        FOR_EACH,
        FOR,
        WHILE
    }

}
