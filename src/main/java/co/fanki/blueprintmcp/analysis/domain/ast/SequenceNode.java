package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * Runs several chains one after the other.
 *
 * @param steps one block per linked output, in pin order
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SequenceNode(List<CaseBlock> steps, SourceLocation location)
        implements Statement {

    public SequenceNode {
        steps = List.copyOf(steps);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitSequence(this);
    }

}
