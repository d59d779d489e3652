package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.EventNode;
import co.fanki.blueprintmcp.analysis.domain.ast.EventReferenceExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.graph.domain.NodeKinds;
import co.fanki.blueprintmcp.parsing.domain.ObjectPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry nodes: engine events, custom events, component bound events,
 * input events and function entries.
 *
 * <p>The data outputs of the event become its parameters and are bound
 * structurally, so every read inside the body refers to them by name.
 * The {@code OutputDelegate} pin is not a parameter: reading it yields a
 * reference to the event, as when the event is bound to a delegate.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EventProcessor implements NodeProcessor {

    private static final String OUTPUT_DELEGATE = "OutputDelegate";

    private static final String ENGINE_EVENT_PREFIX = "Receive";

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final List<EventNode.Parameter> parameters = new ArrayList<>();
        for (final GraphPin pin : node.dataOutputs()) {
            if (OUTPUT_DELEGATE.equals(pin.pinName())) {
                continue;
            }
            parameters.add(new EventNode.Parameter(pin.pinName(),
                    pin.typeName()));
            context.bindStructural(GraphAnalyzer.pinKey(node, pin),
                    new VariableGetExpression(
                            GraphAnalyzer.identifier(pin.pinName()), false,
                            context.locationOf(node)));
        }

        final ExecutionBlock body = analyzer.traverseBlock(context,
                GraphAnalyzer.defaultExecOutput(node));
        return NodeProcessingResult.terminal(new EventNode(eventName(node),
                parameters, body, context.locationOf(node)));
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        if (OUTPUT_DELEGATE.equals(output.pinName())) {
            return new EventReferenceExpression(eventName(node),
                    context.locationOf(node));
        }
        return NodeProcessor.super.processExpression(analyzer, context, node,
                output);
    }

    /**
     * Returns the name an event is known by.
     *
     * @param node the event node
     * @return the name, {@code BeginPlay} for {@code ReceiveBeginPlay}
     */
    static String eventName(final GraphNode node) {
        final String engineEvent = node.memberText("EventReference",
                "MemberName");
        if (engineEvent != null) {
            return engineEvent.startsWith(ENGINE_EVENT_PREFIX)
                    && engineEvent.length() > ENGINE_EVENT_PREFIX.length()
                    ? engineEvent.substring(ENGINE_EVENT_PREFIX.length())
                    : engineEvent;
        }

        final String name = switch (node.kind()) {
            case NodeKinds.CUSTOM_EVENT -> node.text("CustomFunctionName");
            case NodeKinds.FUNCTION_ENTRY -> node.memberText(
                    "FunctionReference", "MemberName");
            case NodeKinds.COMPONENT_BOUND_EVENT -> componentEventName(node);
            case NodeKinds.INPUT_ACTION -> node.text("InputActionName");
            case NodeKinds.INPUT_AXIS_EVENT -> node.text("InputAxisName");
            case NodeKinds.INPUT_KEY -> node.memberText("InputKey",
                    "KeyName") != null
                    ? node.memberText("InputKey", "KeyName")
                    : node.text("InputKey");
            case NodeKinds.ENHANCED_INPUT_ACTION -> ObjectPath.assetName(
                    node.text("InputAction"));
            default -> null;
        };
        return name != null && !name.isBlank() ? name : node.name();
    }

    private static String componentEventName(final GraphNode node) {
        final String delegate = node.text("DelegatePropertyName");
        final String component = node.text("ComponentPropertyName");
        if (delegate == null) {
            return null;
        }
        return component != null ? component + "." + delegate : delegate;
    }

}
