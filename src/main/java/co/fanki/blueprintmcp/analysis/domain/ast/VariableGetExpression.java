package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Reads a variable.
 *
 * @param name the variable name
 * @param selfContext whether the variable is a member of the blueprint
 *      itself rather than a local
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VariableGetExpression(String name, boolean selfContext,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitVariableGet(this);
    }

}
