package co.fanki.blueprintmcp.shared;

/**
 * Raised when the caller hands over input the pipeline cannot work on.
 *
 * <p>Only top-level input problems surface this way: empty text, text
 * without a single object block, or an unknown blueprint kind or render
 * style. Problems inside a blueprint never throw; they are carried as
 * markers in the produced tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code for missing or unparseable blueprint text. */
    public static final String INVALID_INPUT = "INVALID_INPUT";

    /** Error code for an unrecognized blueprint kind or render style. */
    public static final String UNKNOWN_BLUEPRINT_KIND =
            "UNKNOWN_BLUEPRINT_KIND";

    private final String errorCode;

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public DomainException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
