package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.AssignmentNode;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.Optional;

/**
 * Variable writes. The value comes from the input pin named after the
 * variable; the output pin, when read, is the variable itself.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class VariableSetProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final Optional<GraphPin> valuePin = valuePin(node);
        final String name = name(node, valuePin);

        final Expression target = VariableGetProcessor.variable(analyzer,
                context, node, name);
        final Expression value = valuePin
                .map(pin -> analyzer.resolveInput(context, node, pin))
                .orElseGet(() -> new UnsupportedExpression(
                        "no value pin for '" + name + "'", node.kind(),
                        context.locationOf(node)));
        final boolean local = node.memberText("VariableReference",
                "MemberScope") != null;

        return NodeProcessingResult.of(new AssignmentNode(target, value,
                AssignmentNode.ASSIGN, local, context.locationOf(node)));
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        return VariableGetProcessor.variable(analyzer, context, node,
                name(node, valuePin(node)));
    }

    private static Optional<GraphPin> valuePin(final GraphNode node) {
        final String name = VariableGetProcessor.variableName(node);
        if (name != null) {
            final Optional<GraphPin> named = node.findInput(name);
            if (named.isPresent()) {
                return named;
            }
        }
        return node.dataInputs().stream()
                .filter(pin -> !"self".equals(pin.pinName()))
                .findFirst();
    }

    private static String name(final GraphNode node,
            final Optional<GraphPin> valuePin) {
        final String name = VariableGetProcessor.variableName(node);
        if (name != null) {
            return name;
        }
        return valuePin.map(GraphPin::pinName).orElse(node.name());
    }

}
