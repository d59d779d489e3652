package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node no processor understood, kept with everything known about it.
 *
 * @param nodeKind the node kind, e.g. {@code K2Node_Timeline}
 * @param nodeName the node name
 * @param properties the node properties as raw text
 * @param pinValues the resolved values of its data inputs
 * @param branches its linked exec outputs, when more than one is linked
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FallbackNode(String nodeKind, String nodeName,
        Map<String, String> properties, List<Argument> pinValues,
        List<CaseBlock> branches, SourceLocation location)
        implements Statement {

    public FallbackNode {
        properties = Collections.unmodifiableMap(
                new LinkedHashMap<>(properties));
        pinValues = List.copyOf(pinValues);
        branches = List.copyOf(branches);
    }

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitFallback(this);
    }

}
