package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Casts a value to a type.
 *
 * @param targetType the type cast to
 * @param source the value cast
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CastExpression(String targetType, Expression source,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitCast(this);
    }

}
