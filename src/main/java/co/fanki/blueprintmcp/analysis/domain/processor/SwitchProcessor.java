package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.CaseBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.SwitchNode;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.ArrayList;
import java.util.List;

/**
 * Switches on enums, integers, strings and names. Every linked exec
 * output is a case, labeled with its display name when it has one.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SwitchProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final Expression selector = analyzer.resolveInput(context, node,
                "Selection");
        return NodeProcessingResult.terminal(new SwitchNode(selector,
                cases(analyzer, context, node), context.locationOf(node)));
    }

    /**
     * Traverses every linked exec output of a node as a case.
     *
     * @param analyzer the analyzer
     * @param context the traversal state
     * @param node the node
     * @return the cases in pin order
     */
    static List<CaseBlock> cases(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final List<CaseBlock> cases = new ArrayList<>();
        for (final GraphPin output : node.execOutputs()) {
            if (!output.linked()) {
                continue;
            }
            final String label = output.friendlyName() != null
                    ? output.friendlyName() : output.pinName();
            cases.add(new CaseBlock(label,
                    analyzer.traverseBlock(context, output)));
        }
        return cases;
    }

}
