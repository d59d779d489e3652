package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.ProcessorRegistry;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.SwitchNode;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

/**
 * Macros without a dedicated processor, read as a call to
 * {@code Macro_<Name>}. A macro driving several linked exec outputs,
 * such as {@code Gate} or {@code DoOnce}, is read as a switch over the
 * call instead, one case per output.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MacroInstanceProcessor extends AbstractCallProcessor {

    @Override
    protected String functionName(final GraphNode node) {
        final String macro = ProcessorRegistry.macroName(node);
        return "Macro_" + (macro != null ? macro : "Unknown");
    }

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final long linked = node.execOutputs().stream()
                .filter(GraphPin::linked).count();
        if (linked <= 1) {
            return super.processStatement(analyzer, context, node);
        }
        final FunctionCallExpression call = new FunctionCallExpression(null,
                functionName(node),
                analyzer.resolveArguments(context, node, excludedInputs()),
                context.locationOf(node));
        return NodeProcessingResult.terminal(new SwitchNode(call,
                SwitchProcessor.cases(analyzer, context, node),
                context.locationOf(node)));
    }

}
