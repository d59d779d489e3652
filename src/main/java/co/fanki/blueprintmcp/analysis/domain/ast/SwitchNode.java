package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * A multi way branch on a selector value.
 *
 * @param selector the value switched on
 * @param cases the linked cases, in pin order
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SwitchNode(Expression selector, List<CaseBlock> cases,
        SourceLocation location) implements Statement {

    public SwitchNode {
        cases = List.copyOf(cases);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitSwitch(this);
    }

}
