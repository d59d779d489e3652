package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.PinAliases;
import co.fanki.blueprintmcp.analysis.domain.ast.BranchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;

/**
 * {@code K2Node_IfThenElse}. Both arms are owned by the branch, so
 * traversal stops after it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class BranchProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final Expression condition = analyzer.resolveInput(context, node,
                "Condition");
        final ExecutionBlock whenTrue = analyzer.traverseBlock(context,
                PinAliases.find(node, PinAliases.Role.THEN).orElse(null));
        final ExecutionBlock whenFalse = analyzer.traverseBlock(context,
                PinAliases.find(node, PinAliases.Role.ELSE).orElse(null));
        return NodeProcessingResult.terminal(new BranchNode(condition,
                whenTrue, whenFalse, context.locationOf(node)));
    }

}
