package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Binds an output of an impure call to a local name, so later reads of
 * that output refer to the value produced when the call ran.
 *
 * @param pinName the output pin name
 * @param variableName the local name
 * @param typeName the value type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record OutputBinding(String pinName, String variableName,
        String typeName) {
}
