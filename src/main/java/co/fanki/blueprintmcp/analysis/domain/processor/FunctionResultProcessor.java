package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.ReturnNode;
import co.fanki.blueprintmcp.graph.domain.GraphNode;

import java.util.Set;

/**
 * {@code K2Node_FunctionResult}, the return of a function graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FunctionResultProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        return NodeProcessingResult.terminal(new ReturnNode(
                analyzer.resolveArguments(context, node, Set.of()),
                context.locationOf(node)));
    }

}
