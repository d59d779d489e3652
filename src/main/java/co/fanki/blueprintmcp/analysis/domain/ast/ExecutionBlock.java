package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * An ordered list of statements: the body of an event, a branch arm, a
 * loop or a callback.
 *
 * @param statements the statements in execution order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecutionBlock(List<Statement> statements) {

    public ExecutionBlock {
        statements = List.copyOf(statements);
    }

    /** An empty block. */
    public static ExecutionBlock empty() {
        return new ExecutionBlock(List.of());
    }

}
