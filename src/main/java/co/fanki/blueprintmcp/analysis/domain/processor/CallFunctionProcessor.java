package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;

import java.util.Set;

/**
 * Function calls: plain, on arrays, on the parent class and the
 * commutative operators such as {@code Add_IntInt}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CallFunctionProcessor extends AbstractCallProcessor {

    static final String CALL_ARRAY_FUNCTION = "K2Node_CallArrayFunction";
    static final String CALL_PARENT_FUNCTION = "K2Node_CallParentFunction";

    private static final String TARGET_ARRAY = "TargetArray";

    @Override
    protected String functionName(final GraphNode node) {
        final String member = node.memberText("FunctionReference",
                "MemberName");
        return member != null ? member : node.name();
    }

    @Override
    protected Expression target(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        return switch (node.kind()) {
            case CALL_ARRAY_FUNCTION -> analyzer.resolveTarget(context, node,
                    TARGET_ARRAY);
            case CALL_PARENT_FUNCTION -> new VariableGetExpression("super",
                    true, context.locationOf(node));
            default -> super.target(analyzer, context, node);
        };
    }

    @Override
    protected Set<String> excludedInputs() {
        return Set.of(TARGET_ARRAY);
    }

}
