package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.parsing.domain.ObjectPath;

/**
 * {@code K2Node_Literal}: a reference to a level object.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LiteralProcessor implements NodeProcessor {

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        return new LiteralExpression(ObjectPath.unwrap(node.text("ObjectRef")),
                LiteralExpression.LiteralType.OBJECT,
                context.locationOf(node));
    }

}
