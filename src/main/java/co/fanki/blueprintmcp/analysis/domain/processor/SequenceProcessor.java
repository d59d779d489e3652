package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.CaseBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.SequenceNode;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code K2Node_ExecutionSequence}: the {@code then_N} outputs run one
 * after the other, in index order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SequenceProcessor implements NodeProcessor {

    private static final Pattern STEP = Pattern.compile("(?i)then_(\\d+)");

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final List<GraphPin> outputs = new ArrayList<>(node.execOutputs());
        outputs.sort(Comparator.comparingInt(SequenceProcessor::stepIndex));

        final List<CaseBlock> steps = new ArrayList<>();
        for (final GraphPin output : outputs) {
            if (output.linked()) {
                steps.add(new CaseBlock(output.pinName(),
                        analyzer.traverseBlock(context, output)));
            }
        }
        return NodeProcessingResult.terminal(new SequenceNode(steps,
                context.locationOf(node)));
    }

    /** Pins without an index keep their relative order, last. */
    private static int stepIndex(final GraphPin pin) {
        final Matcher matcher = STEP.matcher(pin.pinName());
        return matcher.matches() ? Integer.parseInt(matcher.group(1))
                : Integer.MAX_VALUE;
    }

}
