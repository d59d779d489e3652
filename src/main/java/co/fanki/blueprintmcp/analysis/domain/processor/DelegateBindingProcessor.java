package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.EventSubscriptionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.shared.Preconditions;

/**
 * Binding and unbinding events to a multicast delegate, such as a
 * custom event bound to a button's {@code OnClicked}.
 *
 * <p>The result is a subscription, never an assignment: binding adds a
 * handler with {@code +=}, unbinding removes one with {@code -=}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DelegateBindingProcessor implements NodeProcessor {

    private final String operator;

    /**
     * Creates a processor.
     *
     * @param theOperator {@link EventSubscriptionNode#BIND} or
     *      {@link EventSubscriptionNode#UNBIND}
     */
    public DelegateBindingProcessor(final String theOperator) {
        operator = Preconditions.requireNonBlank(theOperator,
                "The operator cannot be blank");
    }

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final String delegate = node.memberText("DelegateReference",
                "MemberName");
        final Expression target = analyzer.resolveTarget(context, node,
                "self");
        final Expression handler = analyzer.resolveInput(context, node,
                "Delegate");
        return NodeProcessingResult.of(new EventSubscriptionNode(target,
                delegate != null ? delegate : node.name(), handler, operator,
                context.locationOf(node)));
    }

}
