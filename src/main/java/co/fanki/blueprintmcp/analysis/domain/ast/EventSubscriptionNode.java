package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Binds or unbinds a handler on a delegate.
 *
 * @param target the object owning the delegate, null for self
 * @param delegateName the delegate, e.g. {@code OnClicked}
 * @param handler the bound handler, usually an event reference
 * @param operator {@code +=} to bind, {@code -=} to unbind
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EventSubscriptionNode(Expression target, String delegateName,
        Expression handler, String operator, SourceLocation location)
        implements Statement {

    public static final String BIND = "+=";

    public static final String UNBIND = "-=";

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitEventSubscription(this);
    }

}
