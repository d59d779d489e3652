package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * The body run when an async action fires one of its triggers.
 *
 * @param triggerName the trigger, the exec output pin name
 * @param payload the values delivered with the trigger
 * @param body the statements run
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CallbackBlock(String triggerName,
        List<VariableDeclaration> payload, ExecutionBlock body) {

    public CallbackBlock {
        payload = List.copyOf(payload);
    }

}
