package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * An entry point: the event name, its parameters and the body it runs.
 *
 * @param eventName the event name, e.g. {@code BeginPlay}
 * @param parameters the parameters carried by the event
 * @param body the statements executed when the event fires
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EventNode(String eventName, List<Parameter> parameters,
        ExecutionBlock body, SourceLocation location) implements Statement {

    public EventNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitEvent(this);
    }

    /**
     * An event parameter.
     *
     * @param name the parameter name
     * @param typeName the parameter type
     */
    public record Parameter(String name, String typeName) {
    }

}
