package co.fanki.blueprintmcp.config;

import co.fanki.blueprintmcp.blueprint.application.BlueprintKind;
import co.fanki.blueprintmcp.blueprint.application.BlueprintService;
import co.fanki.blueprintmcp.rendering.domain.RenderStyle;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Configures the MCP stdio server transport for AI assistant integration.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. The {@code mcp} profile also
 * disables the web server and console logging, since stdout carries the
 * protocol.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String RENDER_BLUEPRINT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "text": {
                  "type": "string",
                  "description": "The copied blueprint nodes, starting with Begin Object"
                },
                "kind": {
                  "type": "string",
                  "enum": ["auto", "event_graph", "widget_tree"],
                  "description": "What the text holds (defaults to auto)"
                },
                "style": {
                  "type": "string",
                  "enum": ["concise", "verbose"],
                  "description": "Output detail (defaults to the server setting)"
                }
              },
              "required": ["text"]
            }
            """;

    private static final String ANALYZE_BLUEPRINT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "text": {
                  "type": "string",
                  "description": "The copied event graph nodes"
                }
              },
              "required": ["text"]
            }
            """;

    private static final String LIST_NODE_PROCESSORS_SCHEMA = """
            {
              "type": "object",
              "properties": {}
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param blueprintService the service that handles all tool operations
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final BlueprintService blueprintService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("blueprint-mcp-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(renderBlueprintTool(blueprintService, objectMapper));
        server.addTool(analyzeBlueprintTool(blueprintService, objectMapper));
        server.addTool(listNodeProcessorsTool(blueprintService,
                objectMapper));

        LOG.info("MCP stdio server initialized with 3 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification renderBlueprintTool(
            final BlueprintService blueprintService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("render_blueprint",
                        "Render copied blueprint nodes as markdown. Event"
                                + " graphs become pseudocode per event,"
                                + " widget layouts become a hierarchy. The"
                                + " markdown field of the result holds the"
                                + " text to read.",
                        RENDER_BLUEPRINT_SCHEMA),
                (exchange, arguments) -> {
                    final String text = (String) arguments.get("text");
                    final String kind = (String) arguments.get("kind");
                    final String style = (String) arguments.get("style");

                    try {
                        final var result = blueprintService.render(text,
                                BlueprintKind.fromText(kind),
                                style == null || style.isBlank()
                                        ? null : RenderStyle.fromText(style));
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification analyzeBlueprintTool(
            final BlueprintService blueprintService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("analyze_blueprint",
                        "Return the logical tree of copied event graph"
                                + " nodes as JSON: one statement per entry"
                                + " point, every node tagged with its type.",
                        ANALYZE_BLUEPRINT_SCHEMA),
                (exchange, arguments) -> {
                    final String text = (String) arguments.get("text");

                    try {
                        final var result = blueprintService.analyze(text);
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification listNodeProcessorsTool(
            final BlueprintService blueprintService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("list_node_processors",
                        "List the node kinds with a specialized processor."
                                + " Other nodes are rendered generically or"
                                + " as fallback markers.",
                        LIST_NODE_PROCESSORS_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final var result =
                                blueprintService.describeProcessors();
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
