package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.BranchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;

import java.util.List;

/**
 * The {@code IsValid} macro, a branch on the validity of its input.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class IsValidMacroProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final FunctionCallExpression condition = new FunctionCallExpression(
                null, "IsValid", List.of(new Argument("InputObject",
                        analyzer.resolveInput(context, node, "InputObject"))),
                context.locationOf(node));
        return NodeProcessingResult.terminal(new BranchNode(condition,
                analyzer.traverseBlock(context,
                        node.findOutput("Is Valid").orElse(null)),
                analyzer.traverseBlock(context,
                        node.findOutput("Is Not Valid").orElse(null)),
                context.locationOf(node)));
    }

}
