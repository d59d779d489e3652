package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Marks a value that could not be resolved. Rendered as a visible
 * marker, never replaced by a default.
 *
 * @param reason what went wrong
 * @param nodeKind the kind of the producing node, null when there is none
 * @param location the node the value was needed by, or produced by
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record UnsupportedExpression(String reason, String nodeKind,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitUnsupported(this);
    }

}
