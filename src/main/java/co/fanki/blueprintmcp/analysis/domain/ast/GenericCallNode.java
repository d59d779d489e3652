package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * A call produced for a node kind without a dedicated processor, matched
 * by its exec pins and member reference.
 *
 * @param nodeKind the node kind the call was recognized on
 * @param target the call target, null for self
 * @param functionName the referenced member name
 * @param arguments the arguments in pin order
 * @param outputs the outputs bound to local names
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GenericCallNode(String nodeKind, Expression target,
        String functionName, List<Argument> arguments,
        List<OutputBinding> outputs, SourceLocation location)
        implements Statement {

    public GenericCallNode {
        arguments = List.copyOf(arguments);
        outputs = List.copyOf(outputs);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitGenericCall(this);
    }

}
