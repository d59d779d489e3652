package co.fanki.blueprintmcp.analysis.domain;

/**
 * Raised when a processor breaks its contract, returning nothing or the
 * wrong kind of node. A bug in the processor, not in the blueprint.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProcessorContractException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message what the processor did wrong
     */
    public ProcessorContractException(final String message) {
        super(message);
    }

}
