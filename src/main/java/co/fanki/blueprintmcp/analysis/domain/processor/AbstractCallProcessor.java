package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallNode;
import co.fanki.blueprintmcp.analysis.domain.ast.OutputBinding;
import co.fanki.blueprintmcp.analysis.domain.ast.PropertyAccessNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.List;
import java.util.Set;

/**
 * Base of the processors that read a node as a function call.
 *
 * <p>Impure nodes become a {@link FunctionCallNode} whose linked outputs
 * are bound to local names; pure nodes become a
 * {@link FunctionCallExpression} evaluated where their value is read.
 * Reading one of several outputs of a pure call yields a property
 * access on the call.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
abstract class AbstractCallProcessor implements NodeProcessor {

    /**
     * Returns the name of the function the node calls.
     *
     * @param node the node
     * @return the function name, never null
     */
    protected abstract String functionName(GraphNode node);

    /**
     * Resolves the object the function is called on.
     *
     * @param analyzer the analyzer
     * @param context the traversal state
     * @param node the node
     * @return the target, null for calls on self
     */
    protected Expression target(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        return analyzer.resolveTarget(context, node, "self");
    }

    /** Inputs that are not arguments, besides the implicit ones. */
    protected Set<String> excludedInputs() {
        return Set.of();
    }

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final String function = functionName(node);
        final Expression target = target(analyzer, context, node);
        final List<Argument> arguments = analyzer.resolveArguments(context,
                node, excludedInputs());
        final List<OutputBinding> outputs = analyzer.bindOutputs(context,
                node, function);
        return NodeProcessingResult.of(new FunctionCallNode(target, function,
                arguments, outputs, context.locationOf(node)));
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final String function = functionName(node);
        if (node.impure()) {
            return new UnsupportedExpression("output '" + output.pinName()
                    + "' of " + function + " read outside the scope where it"
                    + " executed", node.kind(), context.locationOf(node));
        }
        final FunctionCallExpression call = new FunctionCallExpression(
                target(analyzer, context, node), function,
                analyzer.resolveArguments(context, node, excludedInputs()),
                context.locationOf(node));
        if (node.dataOutputs().size() > 1
                && !"ReturnValue".equals(output.pinName())) {
            return new PropertyAccessNode(call, output.pinName(),
                    context.locationOf(node));
        }
        return call;
    }

}
