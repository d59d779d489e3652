package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.PatternProcessor;
import co.fanki.blueprintmcp.analysis.domain.PinAliases;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.GenericCallNode;
import co.fanki.blueprintmcp.analysis.domain.ast.OutputBinding;
import co.fanki.blueprintmcp.graph.domain.GraphNode;

import java.util.List;
import java.util.Set;

/**
 * Any node shaped like a call: an execute input or a then output, plus
 * a reference naming what it calls. Covers the many call-like node kinds
 * no dedicated processor knows, e.g. interface messages.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GenericCallableProcessor implements PatternProcessor {

    /** Struct properties whose {@code MemberName} names the callee. */
    private static final List<String> MEMBER_REFERENCES = List.of(
            "FunctionReference", "DelegateReference", "EventReference");

    @Override
    public boolean matches(final GraphNode node) {
        final boolean callShaped =
                PinAliases.find(node, PinAliases.Role.EXECUTE).isPresent()
                || PinAliases.find(node, PinAliases.Role.THEN).isPresent();
        return callShaped && memberName(node) != null;
    }

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final String function = memberName(node);
        final Expression target = analyzer.resolveTarget(context, node,
                "self");
        final List<Argument> arguments = analyzer.resolveArguments(context,
                node, Set.of());
        final List<OutputBinding> outputs = analyzer.bindOutputs(context,
                node, function);
        return NodeProcessingResult.of(new GenericCallNode(node.kind(),
                target, function, arguments, outputs,
                context.locationOf(node)));
    }

    /**
     * Returns the callee named by a node.
     *
     * @param node the node
     * @return the member name, or null when the node references none
     */
    static String memberName(final GraphNode node) {
        for (final String reference : MEMBER_REFERENCES) {
            final String member = node.memberText(reference, "MemberName");
            if (member != null && !member.isBlank()) {
                return member;
            }
        }
        final String proxy = node.text("ProxyFactoryFunctionName");
        return proxy != null && !proxy.isBlank() ? proxy : null;
    }

}
