package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * A named argument of a call.
 *
 * @param name the parameter name, the input pin name
 * @param value the argument value
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Argument(String name, Expression value) {
}
