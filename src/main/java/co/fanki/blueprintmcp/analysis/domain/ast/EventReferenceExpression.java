package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Names an event used as a value, typically a handler bound to a
 * delegate.
 *
 * @param eventName the event name
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EventReferenceExpression(String eventName,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitEventReference(this);
    }

}
