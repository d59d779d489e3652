package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.PropertyAccessNode;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

/**
 * Variable reads. A variable read through a linked {@code self} pin
 * belongs to another object and becomes a property access on it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class VariableGetProcessor implements NodeProcessor {

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final String name = variableName(node);
        return variable(analyzer, context, node,
                name != null ? name : output.pinName());
    }

    /**
     * Returns the variable a get or set node refers to.
     *
     * @param node the node
     * @return the member name, or null when the node names none
     */
    static String variableName(final GraphNode node) {
        return node.memberText("VariableReference", "MemberName");
    }

    /**
     * Builds the expression naming a variable of a get or set node.
     *
     * @param analyzer the analyzer
     * @param context the traversal state
     * @param node the node
     * @param name the variable name
     * @return a variable read, or a property access on the owner
     */
    static Expression variable(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final String name) {
        final Expression owner = analyzer.resolveTarget(context, node,
                "self");
        if (owner != null) {
            return new PropertyAccessNode(owner, name,
                    context.locationOf(node));
        }
        final boolean self = "True".equalsIgnoreCase(node.memberText(
                "VariableReference", "bSelfContext"));
        return new VariableGetExpression(name, self, context.locationOf(node));
    }

}
