package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * Leaves a function, handing back its output values.
 *
 * @param values the returned values, by output name
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReturnNode(List<Argument> values, SourceLocation location)
        implements Statement {

    public ReturnNode {
        values = List.copyOf(values);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitReturn(this);
    }

}
