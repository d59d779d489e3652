package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * A call used as a value.
 *
 * @param target the object called on, null for self or static calls
 * @param functionName the function name
 * @param arguments the arguments in pin order
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FunctionCallExpression(Expression target, String functionName,
        List<Argument> arguments, SourceLocation location)
        implements Expression {

    public FunctionCallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitFunctionCallExpression(this);
    }

}
