package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * A node produced in data flow context: a value.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Expression extends AstNode {
}
