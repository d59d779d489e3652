package co.fanki.blueprintmcp.blueprint.application;

import co.fanki.blueprintmcp.blueprint.application.BlueprintService.AnalysisResult;
import co.fanki.blueprintmcp.blueprint.application.BlueprintService.RenderResult;
import co.fanki.blueprintmcp.rendering.domain.RenderStyle;
import co.fanki.blueprintmcp.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for rendering and analyzing blueprint text dumps.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/blueprints")
@Tag(name = "Blueprints",
        description = "Turn copied blueprint nodes into readable text")
public class BlueprintController {

    private static final Logger LOG = LoggerFactory.getLogger(
            BlueprintController.class);

    private final BlueprintService blueprintService;

    /**
     * Creates a new BlueprintController.
     *
     * @param theBlueprintService the blueprint service
     */
    public BlueprintController(final BlueprintService theBlueprintService) {
        this.blueprintService = theBlueprintService;
    }

    /**
     * Renders a dump as markdown.
     *
     * @param request the dump, with optional kind and style
     * @return the rendered result, or 400 on invalid input
     */
    @PostMapping("/render")
    @Operation(summary = "Render a blueprint dump",
            description = "Renders an event graph as pseudocode or a widget"
                    + " layout as a hierarchy. Kind is auto, event_graph or"
                    + " widget_tree; style is concise or verbose.")
    public ResponseEntity<?> render(
            @RequestBody final RenderRequest request) {

        LOG.info("Render request, kind {}, style {}", request.kind(),
                request.style());

        try {
            final RenderStyle style = request.style() == null
                    || request.style().isBlank()
                    ? null : RenderStyle.fromText(request.style());
            final RenderResult result = blueprintService.render(
                    request.text(), BlueprintKind.fromText(request.kind()),
                    style);
            return ResponseEntity.ok(result);
        } catch (final DomainException e) {
            LOG.warn("Render failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Analyzes an event graph dump into its logical tree.
     *
     * @param request the dump
     * @return the tree, or 400 on invalid input
     */
    @PostMapping("/analyze")
    @Operation(summary = "Analyze an event graph",
            description = "Returns the logical tree of every entry point as"
                    + " JSON, each node tagged with its type.")
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {
        try {
            final AnalysisResult result =
                    blueprintService.analyze(request.text());
            return ResponseEntity.ok(result);
        } catch (final DomainException e) {
            LOG.warn("Analysis failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Lists the node kinds handled by a specialized processor.
     *
     * @return the dispatch keys mapped to their processor
     */
    @GetMapping("/processors")
    @Operation(summary = "List node processors")
    public Map<String, String> processors() {
        return blueprintService.describeProcessors();
    }

    /**
     * Request body for rendering.
     *
     * @param text the copied blueprint text
     * @param kind auto, event_graph or widget_tree; optional
     * @param style concise or verbose; optional
     */
    public record RenderRequest(String text, String kind, String style) {}

    /**
     * Request body for analysis.
     *
     * @param text the copied blueprint text
     */
    public record AnalyzeRequest(String text) {}
}
