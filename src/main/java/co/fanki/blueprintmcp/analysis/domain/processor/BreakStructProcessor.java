package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.PropertyAccessNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.List;

/**
 * {@code K2Node_BreakStruct}: every output is a member of the input
 * struct, e.g. {@code Payload.EventMagnitude}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class BreakStructProcessor implements NodeProcessor {

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final List<GraphPin> inputs = node.dataInputs();
        if (inputs.isEmpty()) {
            return new UnsupportedExpression("struct break without input",
                    node.kind(), context.locationOf(node));
        }
        return new PropertyAccessNode(
                analyzer.resolveInput(context, node, inputs.get(0)),
                output.pinName(), context.locationOf(node));
    }

}
