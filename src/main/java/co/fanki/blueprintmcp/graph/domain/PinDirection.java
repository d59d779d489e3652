package co.fanki.blueprintmcp.graph.domain;

/**
 * The side of a node a pin sits on.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum PinDirection {

    INPUT,

    OUTPUT;

    /**
     * Reads the serialized direction. Only {@code EGPD_Output} marks an
     * output; the editor omits the field for inputs.
     *
     * @param text the serialized direction, may be null
     * @return the direction
     */
    public static PinDirection fromText(final String text) {
        return "EGPD_Output".equals(text) ? OUTPUT : INPUT;
    }

}
