package co.fanki.blueprintmcp.graph.domain;

import java.util.Set;

/**
 * Node kind names, the short class names used to dispatch nodes.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NodeKinds {

    public static final String EVENT = "K2Node_Event";
    public static final String CUSTOM_EVENT = "K2Node_CustomEvent";
    public static final String COMPONENT_BOUND_EVENT =
            "K2Node_ComponentBoundEvent";
    public static final String INPUT_ACTION = "K2Node_InputAction";
    public static final String INPUT_KEY = "K2Node_InputKey";
    public static final String INPUT_AXIS_EVENT = "K2Node_InputAxisEvent";
    public static final String ENHANCED_INPUT_ACTION =
            "K2Node_EnhancedInputAction";
    public static final String FUNCTION_ENTRY = "K2Node_FunctionEntry";
    public static final String MACRO_INSTANCE = "K2Node_MacroInstance";

    private static final Set<String> ENTRY_KINDS = Set.of(
            EVENT, CUSTOM_EVENT, COMPONENT_BOUND_EVENT, INPUT_ACTION,
            INPUT_KEY, INPUT_AXIS_EVENT, ENHANCED_INPUT_ACTION,
            FUNCTION_ENTRY);

    private NodeKinds() {
    }

    /**
     * Tells whether a short class name denotes a graph node.
     *
     * @param kind the short class name
     * @return true for K2 and editor graph nodes
     */
    public static boolean isGraphNode(final String kind) {
        return kind.startsWith("K2Node") || kind.startsWith("EdGraphNode");
    }

    /**
     * Tells whether a kind starts an execution chain.
     *
     * @param kind the short class name
     * @return true for event kinds and function entries
     */
    public static boolean isEntryKind(final String kind) {
        return ENTRY_KINDS.contains(kind);
    }

}
