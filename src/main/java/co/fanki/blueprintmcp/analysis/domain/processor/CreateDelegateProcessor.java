package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.EventReferenceExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

/**
 * {@code K2Node_CreateDelegate}: a reference to the selected function.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CreateDelegateProcessor implements NodeProcessor {

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final String function = node.text("SelectedFunctionName");
        return new EventReferenceExpression(
                function != null ? function : node.name(),
                context.locationOf(node));
    }

}
