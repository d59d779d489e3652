package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.PinAliases;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.BranchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.CastExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableDeclaration;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.parsing.domain.ObjectPath;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Object and class casts.
 *
 * <p>An impure cast is a branch on the cast: the success arm opens with
 * the declaration of the cast result, visible only inside that arm. A
 * pure cast is just a cast expression.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DynamicCastProcessor implements NodeProcessor {

    private static final String CAST_FAILED = "CastFailed";
    private static final String SUCCESS = "bSuccess";

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final CastExpression cast = cast(analyzer, context, node);

        Map<String, Expression> bindings = Map.of();
        List<Statement> leading = List.of();
        final Optional<GraphPin> result = resultPin(node);
        if (result.isPresent()) {
            final String name = context.allocateName(
                    GraphAnalyzer.identifier(result.get().pinName()));
            leading = List.of(new VariableDeclaration(name, cast.targetType(),
                    cast, VariableDeclaration.Kind.CAST,
                    context.locationOf(node)));
            bindings = Map.of(GraphAnalyzer.pinKey(node, result.get()),
                    new VariableGetExpression(name, false,
                            context.locationOf(node)));
        }

        final ExecutionBlock success = analyzer.traverseBlock(context,
                PinAliases.find(node, PinAliases.Role.THEN).orElse(null),
                bindings, leading);
        final ExecutionBlock failure = analyzer.traverseBlock(context,
                node.findOutput(CAST_FAILED).orElse(null));
        return NodeProcessingResult.terminal(new BranchNode(cast, success,
                failure, context.locationOf(node)));
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        if (node.impure()) {
            return NodeProcessor.super.processExpression(analyzer, context,
                    node, output);
        }
        final CastExpression cast = cast(analyzer, context, node);
        if (SUCCESS.equals(output.pinName())) {
            return new FunctionCallExpression(null, "IsValid",
                    List.of(new Argument("value", cast)),
                    context.locationOf(node));
        }
        return cast;
    }

    private static CastExpression cast(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final String type = ObjectPath.assetName(node.text("TargetType"));
        final Expression source = node.findInput("Object").isPresent()
                ? analyzer.resolveInput(context, node, "Object")
                : analyzer.resolveInput(context, node, "Class");
        return new CastExpression(type != null ? type : "UnknownType",
                source, context.locationOf(node));
    }

    private static Optional<GraphPin> resultPin(final GraphNode node) {
        for (final GraphPin pin : node.dataOutputs()) {
            if (pin.pinName().startsWith("As ")) {
                return Optional.of(pin);
            }
        }
        return node.dataOutputs().stream()
                .filter(pin -> !SUCCESS.equals(pin.pinName()))
                .findFirst();
    }

}
