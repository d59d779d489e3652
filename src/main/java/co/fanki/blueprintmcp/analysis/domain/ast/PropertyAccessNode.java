package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Reads a member of a value, e.g. {@code Payload.EventMagnitude}.
 *
 * @param base the value read from
 * @param propertyPath the member path
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PropertyAccessNode(Expression base, String propertyPath,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitPropertyAccess(this);
    }

}
