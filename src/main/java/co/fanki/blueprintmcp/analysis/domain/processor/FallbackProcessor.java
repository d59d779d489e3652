package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.CaseBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FallbackNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.parsing.domain.PropertyValue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The last resort for nodes nobody else handles. It never fails and
 * never drops information: the node kind, its raw properties and the
 * values of its inputs are all kept on the {@link FallbackNode}.
 *
 * <p>A node with several linked exec outputs owns them as labeled
 * branches; otherwise traversal continues through its default exec
 * output.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FallbackProcessor implements NodeProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(
            FallbackProcessor.class);

    /** Editor layout, not logic. */
    private static final Set<String> LAYOUT_PROPERTIES = Set.of(
            "NodePosX", "NodePosY", "NodeWidth", "NodeHeight");

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        LOG.debug("No processor for {}, keeping it as a fallback node", node);

        final Map<String, String> properties = new LinkedHashMap<>();
        for (final Map.Entry<String, PropertyValue> property
                : node.properties().entrySet()) {
            if (!LAYOUT_PROPERTIES.contains(property.getKey())) {
                properties.put(property.getKey(),
                        property.getValue().raw().trim());
            }
        }

        final List<Argument> pinValues = new ArrayList<>();
        for (final GraphPin pin : node.dataInputs()) {
            pinValues.add(new Argument(pin.pinName(),
                    analyzer.resolveInput(context, node, pin)));
        }

        final List<GraphPin> linked = node.execOutputs().stream()
                .filter(GraphPin::linked).toList();
        if (linked.size() > 1) {
            final List<CaseBlock> branches = new ArrayList<>();
            for (final GraphPin output : linked) {
                branches.add(new CaseBlock(output.pinName(),
                        analyzer.traverseBlock(context, output)));
            }
            return NodeProcessingResult.terminal(new FallbackNode(node.kind(),
                    node.name(), properties, pinValues, branches,
                    context.locationOf(node)));
        }
        return NodeProcessingResult.of(new FallbackNode(node.kind(),
                node.name(), properties, pinValues, List.of(),
                context.locationOf(node)));
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        return new UnsupportedExpression("no processor for " + node.kind()
                + " (output '" + output.pinName() + "')", node.kind(),
                context.locationOf(node));
    }

}
