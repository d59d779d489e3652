package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * A two way conditional.
 *
 * @param condition the condition
 * @param trueBranch statements run when the condition holds
 * @param falseBranch statements run otherwise
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BranchNode(Expression condition, ExecutionBlock trueBranch,
        ExecutionBlock falseBranch, SourceLocation location)
        implements Statement {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitBranch(this);
    }

}
