package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * A node produced in control flow context.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Statement extends AstNode {
}
