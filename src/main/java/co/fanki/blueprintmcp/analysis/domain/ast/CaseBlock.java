package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * A labeled block: a switch case, a sequence step, or an exec output of
 * a node nothing else understood.
 *
 * @param label the output pin name
 * @param body the statements reached through that output
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CaseBlock(String label, ExecutionBlock body) {
}
