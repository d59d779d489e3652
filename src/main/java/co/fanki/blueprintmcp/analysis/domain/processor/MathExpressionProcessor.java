package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code K2Node_MathExpression}. The formula is kept as written, its
 * variables become the arguments that follow it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MathExpressionProcessor implements NodeProcessor {

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final List<Argument> arguments = new ArrayList<>();
        final String formula = node.text("Expression");
        if (formula != null) {
            arguments.add(new Argument("Expression", new LiteralExpression(
                    formula, LiteralExpression.LiteralType.STRING,
                    context.locationOf(node))));
        }
        arguments.addAll(analyzer.resolveArguments(context, node, Set.of()));
        return new FunctionCallExpression(null, "MathExpression", arguments,
                context.locationOf(node));
    }

}
