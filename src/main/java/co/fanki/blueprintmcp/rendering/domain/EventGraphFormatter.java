package co.fanki.blueprintmcp.rendering.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.AssignmentNode;
import co.fanki.blueprintmcp.analysis.domain.ast.AstNode;
import co.fanki.blueprintmcp.analysis.domain.ast.AstVisitor;
import co.fanki.blueprintmcp.analysis.domain.ast.BranchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.CallbackBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.CaseBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.CastExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.EventNode;
import co.fanki.blueprintmcp.analysis.domain.ast.EventReferenceExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.EventSubscriptionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.FallbackNode;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallNode;
import co.fanki.blueprintmcp.analysis.domain.ast.GenericCallNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LatentActionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopVariableExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.OutputBinding;
import co.fanki.blueprintmcp.analysis.domain.ast.PropertyAccessNode;
import co.fanki.blueprintmcp.analysis.domain.ast.ReturnNode;
import co.fanki.blueprintmcp.analysis.domain.ast.SequenceNode;
import co.fanki.blueprintmcp.analysis.domain.ast.SourceLocation;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.analysis.domain.ast.SwitchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.TraversalBoundaryNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableDeclaration;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.parsing.domain.ObjectPath;
import co.fanki.blueprintmcp.shared.Preconditions;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the logical tree of an event graph as markdown pseudo-code.
 *
 * <p>Statements append lines to the output and return an empty string;
 * expressions return their inline text. Every node kind has a visible
 * rendering, including the fallback and unsupported markers, so nothing
 * the analyzer produced is left out.</p>
 *
 * <p>Instances keep the lines being rendered and are meant for a single
 * {@link #format(String, List)} call.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EventGraphFormatter implements AstVisitor<String> {

    private static final String EMPTY_BLOCK = "// (empty)";

    private final RenderStyle style;
    private final List<String> lines = new ArrayList<>();
    private int depth;

    /**
     * Creates a formatter.
     *
     * @param theStyle the render style
     */
    public EventGraphFormatter(final RenderStyle theStyle) {
        style = Preconditions.requireNonNull(theStyle,
                "The render style cannot be null");
    }

    /**
     * Renders a graph.
     *
     * @param graphName the graph name, used as the title
     * @param statements the top level statements, one per entry node
     * @return the markdown text
     */
    public String format(final String graphName,
            final List<Statement> statements) {
        lines.clear();
        depth = 0;
        lines.add("# " + graphName);
        lines.add("");
        if (statements.isEmpty()) {
            lines.add("_No entry nodes found in this graph._");
        }
        for (final Statement statement : statements) {
            statement.accept(this);
            lines.add("");
        }
        return String.join("\n", lines).stripTrailing() + "\n";
    }

    // -- Statements -------------------------------------------------------

    @Override
    public String visitEvent(final EventNode node) {
        final String parameters = node.parameters().stream()
                .map(p -> typed(p.name(), p.typeName()))
                .collect(Collectors.joining(", "));
        emit("#### Event: " + node.eventName()
                + (parameters.isEmpty() ? "" : "(" + parameters + ")"));
        emit("");
        nested(node.body());
        return "";
    }

    @Override
    public String visitAssignment(final AssignmentNode node) {
        statement(node, (node.local() ? "let " : "")
                + expr(node.target()) + " " + node.operator() + " "
                + expr(node.value()));
        return "";
    }

    @Override
    public String visitFunctionCall(final FunctionCallNode node) {
        statement(node, bindings(node.outputs()) + call(node.target(),
                node.functionName(), node.arguments()));
        return "";
    }

    @Override
    public String visitGenericCall(final GenericCallNode node) {
        statement(node, bindings(node.outputs()) + call(node.target(),
                node.functionName(), node.arguments()));
        return "";
    }

    @Override
    public String visitBranch(final BranchNode node) {
        statement(node, "if (" + expr(node.condition()) + "):");
        nested(node.trueBranch());
        if (!node.falseBranch().statements().isEmpty()) {
            emit("else:");
            nested(node.falseBranch());
        }
        return "";
    }

    @Override
    public String visitSequence(final SequenceNode node) {
        statement(node, "sequence:");
        depth++;
        for (final CaseBlock step : node.steps()) {
            emit(LocalizedText.clean(step.label()) + ":");
            nested(step.body());
        }
        depth--;
        return "";
    }

    @Override
    public String visitSwitch(final SwitchNode node) {
        statement(node, "switch (" + expr(node.selector()) + "):");
        depth++;
        for (final CaseBlock branch : node.cases()) {
            emit("case " + LocalizedText.clean(branch.label()) + ":");
            nested(branch.body());
        }
        depth--;
        return "";
    }

    @Override
    public String visitLoop(final LoopNode node) {
        final String variables = node.variables().stream()
                .map(v -> typed(v.name(), v.typeName()))
                .collect(Collectors.joining(", "));
        final String header = switch (node.kind()) {
            case FOR_EACH -> "for each (" + variables + ") in "
                    + expr(node.source()) + ":";
            case FOR -> "for (" + variables + ") in range("
                    + expr(node.source()) + ", " + expr(node.bound())
                    + "):";
            case WHILE -> "while (" + expr(node.source()) + "):";
        };
        statement(node, header);
        nested(node.body());
        return "";
    }

    @Override
    public String visitLatentAction(final LatentActionNode node) {
        statement(node, "await " + expr(node.call()));
        for (final CallbackBlock callback : node.callbacks()) {
            final String payload = callback.payload().stream()
                    .map(v -> typed(v.name(), v.typeName()))
                    .collect(Collectors.joining(", "));
            emit("// on " + callback.triggerName()
                    + (payload.isEmpty() ? "" : "(" + payload + ")") + ":");
            nested(callback.body());
        }
        return "";
    }

    @Override
    public String visitEventSubscription(final EventSubscriptionNode node) {
        final String target = node.target() == null ? "self"
                : expr(node.target());
        statement(node, target + "." + node.delegateName() + " "
                + node.operator() + " " + expr(node.handler()));
        return "";
    }

    @Override
    public String visitVariableDeclaration(final VariableDeclaration node) {
        final String declared = "declare " + typed(node.name(),
                node.typeName());
        statement(node, node.value() == null ? declared
                : declared + " = " + expr(node.value()));
        return "";
    }

    @Override
    public String visitReturn(final ReturnNode node) {
        statement(node, node.values().isEmpty() ? "return"
                : "return (" + arguments(node.values()) + ")");
        return "";
    }

    @Override
    public String visitFallback(final FallbackNode node) {
        final StringBuilder line = new StringBuilder("// Fallback: ")
                .append(node.nodeKind());
        if (node.nodeName() != null) {
            line.append(" (").append(node.nodeName()).append(')');
        }
        if (!node.properties().isEmpty()) {
            line.append(" [").append(properties(node.properties()))
                    .append(']');
        }
        if (!node.pinValues().isEmpty()) {
            line.append(" {").append(node.pinValues().stream()
                    .map(a -> a.name() + "=" + expr(a.value()))
                    .collect(Collectors.joining(", "))).append('}');
        }
        statement(node, line.toString());
        for (final CaseBlock branch : node.branches()) {
            emit("// " + branch.label() + ":");
            nested(branch.body());
        }
        return "";
    }

    @Override
    public String visitTraversalBoundary(final TraversalBoundaryNode node) {
        emit(switch (node.reason()) {
            case CYCLE -> "// cycle: back to " + node.targetNodeName();
            case BUDGET_EXHAUSTED -> "// traversal budget exhausted at "
                    + node.targetNodeName();
        });
        return "";
    }

    // -- Expressions ------------------------------------------------------

    @Override
    public String visitLiteral(final LiteralExpression node) {
        return literal(node.value(), node.literalType());
    }

    @Override
    public String visitVariableGet(final VariableGetExpression node) {
        return node.name();
    }

    @Override
    public String visitFunctionCallExpression(
            final FunctionCallExpression node) {
        return call(node.target(), node.functionName(), node.arguments());
    }

    @Override
    public String visitPropertyAccess(final PropertyAccessNode node) {
        return expr(node.base()) + "." + node.propertyPath();
    }

    @Override
    public String visitCast(final CastExpression node) {
        return "cast(" + expr(node.source()) + " as " + node.targetType()
                + ")";
    }

    @Override
    public String visitEventReference(final EventReferenceExpression node) {
        return node.eventName();
    }

    @Override
    public String visitLoopVariable(final LoopVariableExpression node) {
        return node.name();
    }

    @Override
    public String visitUnsupported(final UnsupportedExpression node) {
        return "<unsupported: " + node.reason() + ">";
    }

    // -- Helpers ----------------------------------------------------------

    private String expr(final Expression expression) {
        return expression == null ? "None" : expression.accept(this);
    }

    private String call(final Expression target, final String function,
            final List<Argument> arguments) {
        final String prefix = target == null ? "" : expr(target) + ".";
        return prefix + function + "(" + arguments(arguments) + ")";
    }

    private String arguments(final List<Argument> arguments) {
        return arguments.stream()
                .map(a -> "value".equals(a.name()) ? expr(a.value())
                        : a.name() + ": " + expr(a.value()))
                .collect(Collectors.joining(", "));
    }

    private String bindings(final List<OutputBinding> outputs) {
        if (outputs.isEmpty()) {
            return "";
        }
        final String names = outputs.stream()
                .map(o -> typed(o.variableName(), o.typeName()))
                .collect(Collectors.joining(", "));
        return "let " + (outputs.size() == 1 ? names : "(" + names + ")")
                + " = ";
    }

    private String typed(final String name, final String type) {
        return style.detailed() && type != null ? name + ": " + type : name;
    }

    /** Emits a statement line, with its warnings and source reference. */
    private void statement(final AstNode node, final String text) {
        final SourceLocation location = node.location();
        if (location != null) {
            for (final String diagnostic : location.diagnostics()) {
                emit("// warning: " + diagnostic);
            }
        }
        if (style.detailed() && location != null
                && location.nodeName() != null) {
            emit(text + "  // " + location.nodeName());
        } else {
            emit(text);
        }
    }

    private void nested(final ExecutionBlock block) {
        depth++;
        if (block.statements().isEmpty()) {
            emit(EMPTY_BLOCK);
        }
        for (final Statement statement : block.statements()) {
            statement.accept(this);
        }
        depth--;
    }

    private void emit(final String text) {
        lines.add(text.isEmpty() ? "" : style.indent().repeat(depth) + text);
    }

    /**
     * Renders a literal value.
     *
     * @param value the raw value, may be null
     * @param type the literal type
     * @return the text shown for it
     */
    static String literal(final String value,
            final LiteralExpression.LiteralType type) {
        if (value == null) {
            return "None";
        }
        return switch (type) {
            case BOOL -> value.toLowerCase(Locale.ROOT);
            case FLOAT -> number(value);
            case INT, ENUM, STRUCT -> value.isEmpty() ? "None" : value;
            case STRING, NAME -> quote(value);
            case TEXT -> quote(LocalizedText.clean(value));
            case OBJECT -> objectName(value);
            case UNKNOWN -> value.startsWith("/") ? objectName(value)
                    : value.isEmpty() ? "None" : value;
        };
    }

    private static String number(final String value) {
        try {
            final BigDecimal number = new BigDecimal(value.trim())
                    .stripTrailingZeros();
            final String plain = number.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        } catch (final NumberFormatException e) {
            return value;
        }
    }

    private static String objectName(final String value) {
        final String name = value.startsWith("/") || value.contains("'")
                ? ObjectPath.assetName(value) : value;
        return name != null ? name : "None";
    }

    private static String quote(final String value) {
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }

    private static String properties(final Map<String, String> properties) {
        return properties.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }

}
