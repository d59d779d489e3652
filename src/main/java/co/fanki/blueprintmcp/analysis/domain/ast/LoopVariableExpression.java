package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Reads the current element or index of the enclosing loop.
 *
 * @param name the loop variable name
 * @param role what the variable holds
 * @param location the loop node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LoopVariableExpression(String name, Role role,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitLoopVariable(this);
    }

    /** Loop variable roles. */
    public enum Role {
        ELEMENT,
        INDEX
    }

}
