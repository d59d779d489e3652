package co.fanki.blueprintmcp.blueprint.application;

import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.graph.domain.BlueprintGraph;
import co.fanki.blueprintmcp.graph.domain.GraphBuilder;
import co.fanki.blueprintmcp.parsing.domain.RawObject;
import co.fanki.blueprintmcp.parsing.domain.RawObjectParser;
import co.fanki.blueprintmcp.rendering.domain.EventGraphFormatter;
import co.fanki.blueprintmcp.rendering.domain.RenderStyle;
import co.fanki.blueprintmcp.rendering.domain.WidgetTreeFormatter;
import co.fanki.blueprintmcp.shared.DomainException;
import co.fanki.blueprintmcp.widget.domain.WidgetNode;
import co.fanki.blueprintmcp.widget.domain.WidgetTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs a blueprint dump through the whole pipeline.
 *
 * <p>Event graphs go parse, build, analyze and format; widget layouts
 * go parse, build the widget forest and format. Every request works on
 * its own graph and analysis context, nothing is cached between
 * calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class BlueprintService {

    private static final Logger LOG = LoggerFactory.getLogger(
            BlueprintService.class);

    private static final String BEGIN_OBJECT = "Begin Object";

    private static final String WIDGET_TITLE = "Widget Hierarchy";

    private final RawObjectParser parser;
    private final GraphBuilder graphBuilder;
    private final GraphAnalyzer analyzer;
    private final WidgetTreeBuilder widgetTreeBuilder;
    private final RenderStyle defaultStyle;
    private final boolean widgetProperties;

    /**
     * Creates a new BlueprintService.
     *
     * @param theParser the text dump parser
     * @param theGraphBuilder the graph builder
     * @param theAnalyzer the graph analyzer
     * @param theWidgetTreeBuilder the widget forest builder
     * @param theDefaultStyle the style used when a request names none
     * @param showWidgetProperties whether widget properties are rendered
     */
    public BlueprintService(final RawObjectParser theParser,
            final GraphBuilder theGraphBuilder,
            final GraphAnalyzer theAnalyzer,
            final WidgetTreeBuilder theWidgetTreeBuilder,
            @Value("${blueprint.render.default-style:concise}")
            final String theDefaultStyle,
            @Value("${blueprint.render.widget-properties:true}")
            final boolean showWidgetProperties) {
        parser = theParser;
        graphBuilder = theGraphBuilder;
        analyzer = theAnalyzer;
        widgetTreeBuilder = theWidgetTreeBuilder;
        defaultStyle = RenderStyle.fromText(theDefaultStyle);
        widgetProperties = showWidgetProperties;
    }

    /**
     * Renders a dump as markdown.
     *
     * @param text the text dump
     * @param kind the content kind, null or AUTO to detect it
     * @param style the render style, null for the configured default
     * @return the rendered result
     * @throws DomainException when the text holds no object block
     */
    public RenderResult render(final String text, final BlueprintKind kind,
            final RenderStyle style) {
        validate(text);

        final List<RawObject> objects = parser.parse(text);
        final BlueprintKind resolved = kind == null
                || kind == BlueprintKind.AUTO ? detect(objects) : kind;
        final RenderStyle effective = style == null ? defaultStyle : style;

        LOG.info("Rendering {} in {} style", resolved, effective);

        if (resolved == BlueprintKind.WIDGET_TREE) {
            final List<WidgetNode> roots = widgetTreeBuilder.build(objects);
            final String markdown = new WidgetTreeFormatter(effective,
                    widgetProperties).format(roots);
            final int count = roots.stream().mapToInt(WidgetNode::size).sum();
            return new RenderResult(resolved, WIDGET_TITLE, markdown,
                    roots.size(), count);
        }

        final BlueprintGraph graph = graphBuilder.build(objects);
        final List<Statement> statements = analyzer.analyze(graph);
        final String markdown = new EventGraphFormatter(effective)
                .format(graph.graphName(), statements);
        return new RenderResult(resolved, graph.graphName(), markdown,
                statements.size(), graph.size());
    }

    /**
     * Analyzes an event graph dump without rendering it.
     *
     * @param text the text dump
     * @return the graph name and one top level statement per entry
     * @throws DomainException when the text holds no object block
     */
    public AnalysisResult analyze(final String text) {
        validate(text);

        final BlueprintGraph graph = graphBuilder.build(parser.parse(text));
        return new AnalysisResult(graph.graphName(), analyzer.analyze(graph));
    }

    /**
     * Lists the node kinds with a specialized processor.
     *
     * @return the dispatch keys mapped to their processor
     */
    public Map<String, String> describeProcessors() {
        return analyzer.registry().describe();
    }

    /**
     * Decides what a dump holds: any graph node makes it an event graph.
     *
     * @param roots the parsed root objects
     * @return EVENT_GRAPH or WIDGET_TREE
     */
    static BlueprintKind detect(final List<RawObject> roots) {
        for (final RawObject object : RawObject.flatten(roots)) {
            if (object.shortClassName().startsWith("K2Node")) {
                return BlueprintKind.EVENT_GRAPH;
            }
        }
        return BlueprintKind.WIDGET_TREE;
    }

    private static void validate(final String text) {
        if (text == null || text.isBlank()) {
            throw new DomainException("Blueprint text cannot be empty",
                    DomainException.INVALID_INPUT);
        }
        if (!text.contains(BEGIN_OBJECT)) {
            throw new DomainException("Blueprint text holds no '"
                    + BEGIN_OBJECT + "' block. Paste the copied nodes as"
                    + " text.", DomainException.INVALID_INPUT);
        }
    }

    /**
     * The markdown rendering of a dump.
     *
     * @param kind the kind that was rendered
     * @param title the graph name or the widget hierarchy title
     * @param markdown the rendered text
     * @param rootCount entry points or root widgets
     * @param nodeCount graph nodes or widgets
     */
    public record RenderResult(BlueprintKind kind, String title,
            String markdown, int rootCount, int nodeCount) {}

    /**
     * The logical tree of an event graph.
     *
     * @param graphName the graph name
     * @param statements one top level statement per entry node
     */
    public record AnalysisResult(String graphName,
            List<Statement> statements) {}

}
