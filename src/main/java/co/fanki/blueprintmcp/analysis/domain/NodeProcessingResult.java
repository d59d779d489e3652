package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

/**
 * What a processor hands back in control flow context: the statement it
 * produced and where the surrounding traversal goes next.
 *
 * @param statement the produced statement, null for pass-through nodes
 * @param flow how traversal continues
 * @param continuation the pin a pass-through node continues from
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeProcessingResult(Statement statement, Flow flow,
        GraphPin continuation) {

    /** How traversal continues after a node. */
    public enum Flow {
        /**
         * Follow the pending continuation pin when the processor set one,
         * otherwise the node's then pin or its only exec output.
         */
        FOLLOW_DEFAULT,
        /** Follow the given continuation pin. */
        CONTINUE_FROM,
        /** The node consumed all of its outputs, stop here. */
        TERMINATE
    }

    /**
     * A statement after which traversal follows the default exec output.
     *
     * @param statement the statement
     * @return the result
     */
    public static NodeProcessingResult of(final Statement statement) {
        return new NodeProcessingResult(statement, Flow.FOLLOW_DEFAULT, null);
    }

    /**
     * A statement that owns every outgoing path of its node.
     *
     * @param statement the statement
     * @return the result
     */
    public static NodeProcessingResult terminal(final Statement statement) {
        return new NodeProcessingResult(statement, Flow.TERMINATE, null);
    }

    /**
     * No statement; traversal goes straight on through the given pin.
     *
     * @param pin the pin to continue from
     * @return the result
     */
    public static NodeProcessingResult passThrough(final GraphPin pin) {
        return new NodeProcessingResult(null, Flow.CONTINUE_FROM, pin);
    }

}
