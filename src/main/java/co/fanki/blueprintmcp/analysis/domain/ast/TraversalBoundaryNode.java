package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Marks where traversal stopped without expanding a node again.
 *
 * @param reason why traversal stopped
 * @param targetNodeName the node that was not expanded
 * @param location the node that was not expanded
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TraversalBoundaryNode(Reason reason, String targetNodeName,
        SourceLocation location) implements Statement {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitTraversalBoundary(this);
    }

    /** Why traversal stopped. */
    public enum Reason {
        /** The node is already on the current path. */
        CYCLE,
        /** The per-root visit budget ran out. */
        BUDGET_EXHAUSTED
    }

}
