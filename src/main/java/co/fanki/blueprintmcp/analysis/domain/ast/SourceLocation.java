package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.List;

/**
 * Points an AST node back at the graph node it was produced from.
 *
 * @param nodeGuid the originating node guid, null for synthesized nodes
 * @param nodeName the originating node name, null for synthesized nodes
 * @param diagnostics problems recorded on the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceLocation(String nodeGuid, String nodeName,
        List<String> diagnostics) {

    /** Location of nodes that have no graph counterpart. */
    public static final SourceLocation SYNTHETIC =
            new SourceLocation(null, null, List.of());

    public SourceLocation {
        diagnostics = diagnostics == null ? List.of()
                : List.copyOf(diagnostics);
    }

}
