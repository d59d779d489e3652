package co.fanki.blueprintmcp.analysis.domain.ast;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base of every node of the logical tree.
 *
 * <p>Nodes are immutable records. Each one carries the location of the
 * graph node it was produced from, as a lookup key only.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public interface AstNode {

    /**
     * Returns where this node comes from.
     *
     * @return the source location, never null
     */
    SourceLocation location();

    /**
     * Accepts a visitor.
     *
     * @param visitor the visitor
     * @param <T> the visitor result type
     * @return the visitor result
     */
    <T> T accept(AstVisitor<T> visitor);

}
