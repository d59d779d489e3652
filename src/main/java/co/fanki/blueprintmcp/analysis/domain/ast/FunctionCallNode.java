package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * A call executed in control flow, with its outputs bound to locals.
 *
 * @param target the object the function is called on, null for self
 * @param functionName the function name
 * @param arguments the arguments in pin order
 * @param outputs the outputs read later on, bound to local names
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FunctionCallNode(Expression target, String functionName,
        List<Argument> arguments, List<OutputBinding> outputs,
        SourceLocation location) implements Statement {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
        outputs = List.copyOf(outputs);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

}
