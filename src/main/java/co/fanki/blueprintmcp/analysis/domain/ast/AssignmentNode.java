package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Stores a value into a target.
 *
 * @param target the assigned expression, usually a variable read
 * @param value the assigned value
 * @param operator the operator, {@code =} unless stated otherwise
 * @param local whether the target is a local variable being introduced
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AssignmentNode(Expression target, Expression value,
        String operator, boolean local, SourceLocation location)
        implements Statement {

    /** Plain assignment operator. */
    public static final String ASSIGN = "=";

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitAssignment(this);
    }

}
