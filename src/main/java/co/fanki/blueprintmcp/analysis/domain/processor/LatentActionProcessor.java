package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.PinAliases;
import co.fanki.blueprintmcp.analysis.domain.ast.CallbackBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.LatentActionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableDeclaration;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Asynchronous nodes: ability tasks, async actions, AI move requests,
 * montage playback.
 *
 * <p>The node starts a call and later fires one or more callback exec
 * outputs, such as {@code OnCompleted} or {@code OnInterrupted}. Every
 * linked callback becomes a {@link CallbackBlock} traversed in its own
 * scope, where the payload outputs of the node are declared. The
 * {@code then} output fires right after the call starts, so traversal
 * resumes there.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LatentActionProcessor implements NodeProcessor {

    /** Inputs wiring the task to its owner, not real arguments. */
    private static final Set<String> OWNER_INPUTS = Set.of("OwningAbility");

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final FunctionCallExpression call = new FunctionCallExpression(null,
                functionName(node),
                analyzer.resolveArguments(context, node, OWNER_INPUTS),
                context.locationOf(node));

        final List<VariableDeclaration> payload = new ArrayList<>();
        final Map<String, Expression> bindings = new LinkedHashMap<>();
        for (final GraphPin pin : node.dataOutputs()) {
            if (!pin.linked()) {
                continue;
            }
            final String name = context.allocateName(
                    GraphAnalyzer.identifier(pin.pinName()));
            payload.add(new VariableDeclaration(name, pin.typeName(), null,
                    VariableDeclaration.Kind.CALLBACK,
                    context.locationOf(node)));
            bindings.put(GraphAnalyzer.pinKey(node, pin),
                    new VariableGetExpression(name, false,
                            context.locationOf(node)));
        }

        final List<CallbackBlock> callbacks = new ArrayList<>();
        for (final GraphPin output : node.execOutputs()) {
            if (!output.linked() || PinAliases.is(output,
                    PinAliases.Role.THEN)) {
                continue;
            }
            final ExecutionBlock body = analyzer.traverseBlock(context,
                    output, bindings, List.of());
            callbacks.add(new CallbackBlock(output.pinName(), payload, body));
        }

        final LatentActionNode latent = new LatentActionNode(call, callbacks,
                context.locationOf(node));
        final Optional<GraphPin> then = PinAliases.find(node,
                PinAliases.Role.THEN);
        if (then.isEmpty()) {
            return NodeProcessingResult.terminal(latent);
        }
        context.setPendingContinuationPin(then.get());
        return NodeProcessingResult.of(latent);
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        return new UnsupportedExpression("payload '" + output.pinName()
                + "' of " + functionName(node) + " read outside its"
                + " callbacks", node.kind(), context.locationOf(node));
    }

    private static String functionName(final GraphNode node) {
        final String proxy = node.text("ProxyFactoryFunctionName");
        if (proxy != null && !proxy.isBlank()) {
            return proxy;
        }
        final String function = node.memberText("FunctionReference",
                "MemberName");
        return function != null ? function : node.kind().replace("K2Node_",
                "");
    }

}
