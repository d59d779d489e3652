package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.parsing.domain.ObjectPath;

/**
 * Struct construction, rendered as {@code Make<Struct>(member: value)}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MakeStructProcessor extends AbstractCallProcessor {

    @Override
    protected String functionName(final GraphNode node) {
        final String struct = ObjectPath.assetName(node.text("StructType"));
        return "Make" + (struct != null ? struct : "Struct");
    }

    @Override
    protected Expression target(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        return null;
    }

}
