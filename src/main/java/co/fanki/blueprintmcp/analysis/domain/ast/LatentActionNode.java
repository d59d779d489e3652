package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * An async action: the call that starts it and the callbacks it fires
 * later on.
 *
 * @param call the starting call
 * @param callbacks the linked callbacks, in pin order
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LatentActionNode(FunctionCallExpression call,
        List<CallbackBlock> callbacks, SourceLocation location)
        implements Statement {

    public LatentActionNode {
        callbacks = List.copyOf(callbacks);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitLatentAction(this);
    }

}
