package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.List;
import java.util.Optional;

/**
 * Array element reads, rendered as {@code Array.Get(Index: i)}. The
 * array is the first data input, the index the second, whatever the
 * engine version names them.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GetArrayItemProcessor implements NodeProcessor {

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final List<GraphPin> inputs = node.dataInputs();
        final Optional<GraphPin> array = node.findInput("TargetArray")
                .or(() -> inputs.isEmpty() ? Optional.empty()
                        : Optional.of(inputs.get(0)));
        final Optional<GraphPin> index = node.findInput("Index")
                .or(() -> inputs.size() < 2 ? Optional.empty()
                        : Optional.of(inputs.get(1)));
        if (array.isEmpty() || index.isEmpty()) {
            return new UnsupportedExpression("array read without array or"
                    + " index input", node.kind(), context.locationOf(node));
        }
        return new FunctionCallExpression(
                analyzer.resolveInput(context, node, array.get()), "Get",
                List.of(new Argument("Index",
                        analyzer.resolveInput(context, node, index.get()))),
                context.locationOf(node));
    }

}
