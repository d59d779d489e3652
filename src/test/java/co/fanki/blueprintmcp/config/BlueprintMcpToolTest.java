package co.fanki.blueprintmcp.config;

import co.fanki.blueprintmcp.Fixtures;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.processor.StandardProcessors;
import co.fanki.blueprintmcp.blueprint.application.BlueprintService;
import co.fanki.blueprintmcp.graph.domain.GraphBuilder;
import co.fanki.blueprintmcp.parsing.domain.RawObjectParser;
import co.fanki.blueprintmcp.widget.domain.WidgetTreeBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for the blueprint MCP tools.
 *
 * <p>Simulates an LLM client talking to the MCP server over the stdio
 * transport through in-process pipes: initialize handshake, tool
 * listing and tool invocation, with the real pipeline behind the
 * tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class BlueprintMcpToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private McpSyncServer server;
    private PrintWriter clientWriter;
    private BufferedReader clientReader;
    private PipedOutputStream clientToServer;

    /** A piped stream breaks once the thread reading it ends. */
    private ExecutorService responseReader;

    @BeforeEach
    void setUp() throws Exception {
        responseReader = Executors.newSingleThreadExecutor();

        // Wire pipes: client writes → serverIn; server writes → serverToClient.
        clientToServer = new PipedOutputStream();
        final PipedInputStream serverIn =
                new PipedInputStream(clientToServer);
        final PipedOutputStream serverOut = new PipedOutputStream();
        final PipedInputStream serverToClient =
                new PipedInputStream(serverOut);

        final BlueprintService blueprintService = new BlueprintService(
                new RawObjectParser(), new GraphBuilder(),
                new GraphAnalyzer(StandardProcessors.create(),
                        GraphAnalyzer.DEFAULT_MAX_NODE_VISITS),
                new WidgetTreeBuilder(), "concise", true);

        final StdioServerTransportProvider transport =
                new StdioServerTransportProvider(
                        objectMapper, serverIn, serverOut);

        server = new McpStdioServerConfiguration()
                .mcpSyncServer(transport, blueprintService, objectMapper);

        clientWriter = new PrintWriter(new OutputStreamWriter(
                clientToServer, StandardCharsets.UTF_8));
        clientReader = new BufferedReader(new InputStreamReader(
                serverToClient, StandardCharsets.UTF_8));

        performHandshake();
    }

    @AfterEach
    void tearDown() {
        try {
            clientToServer.close();
        } catch (final Exception ignored) {}
        if (server != null) {
            server.close();
        }
        responseReader.shutdownNow();
    }

    @Test
    void whenListingTools_shouldIncludeBlueprintTools() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"tools/list\","
                + "\"params\":{}}");

        final JsonNode tools = readJson().path("result").path("tools");
        assertTrue(tools.isArray());

        final Set<String> names = new HashSet<>();
        for (final JsonNode tool : tools) {
            names.add(tool.path("name").asText());
            if ("render_blueprint".equals(tool.path("name").asText())) {
                final JsonNode properties = tool.path("inputSchema")
                        .path("properties");
                assertEquals("string",
                        properties.path("text").path("type").asText(),
                        "text parameter must be type string");
                assertEquals(3, properties.path("kind").path("enum")
                        .size());
            }
        }
        assertEquals(Set.of("render_blueprint", "analyze_blueprint",
                "list_node_processors"), names);
    }

    @Test
    void whenCallingRender_givenEventGraph_shouldReturnMarkdown()
            throws Exception {
        final ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("text", Fixtures.load("set_health.txt"));
        callTool(20, "render_blueprint", arguments);

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode rendered = objectMapper.readTree(result
                .path("content").get(0).path("text").asText());
        assertEquals("EVENT_GRAPH", rendered.path("kind").asText());
        assertEquals("BP_Door EventGraph", rendered.path("title").asText());
        assertTrue(rendered.path("markdown").asText()
                .contains("  Health = 100.0"),
                "Markdown should hold the assignment");
    }

    @Test
    void whenCallingRender_givenWidgetLayoutAndVerboseStyle_shouldIndentFour()
            throws Exception {
        final ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("text", Fixtures.load("main_menu_widgets.txt"));
        arguments.put("kind", "widget_tree");
        arguments.put("style", "verbose");
        callTool(21, "render_blueprint", arguments);

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode rendered = objectMapper.readTree(result
                .path("content").get(0).path("text").asText());
        assertTrue(rendered.path("markdown").asText()
                .contains("\n    - **TitleText** (TextBlock)\n"));
        assertEquals(4, rendered.path("nodeCount").asInt());
    }

    @Test
    void whenCallingRender_givenBlankText_shouldReturnError()
            throws Exception {
        final ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("text", "   ");
        callTool(30, "render_blueprint", arguments);

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean(),
                "Blank text should return isError=true");
        assertTrue(result.path("content").get(0).path("text").asText()
                .startsWith("Error: "));
    }

    @Test
    void whenCallingRender_givenUnknownKind_shouldReturnError()
            throws Exception {
        final ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("text", Fixtures.load("set_health.txt"));
        arguments.put("kind", "material");
        callTool(31, "render_blueprint", arguments);

        assertTrue(readJson().path("result").path("isError").asBoolean());
    }

    @Test
    void whenCallingAnalyze_givenEventGraph_shouldReturnTypedTree()
            throws Exception {
        final ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("text", Fixtures.load("set_health.txt"));
        callTool(40, "analyze_blueprint", arguments);

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode tree = objectMapper.readTree(result.path("content")
                .get(0).path("text").asText());
        final JsonNode event = tree.path("statements").get(0);
        assertEquals("EventNode", event.path("type").asText());
        assertEquals("BeginPlay", event.path("eventName").asText());
        assertEquals("AssignmentNode", event.path("body")
                .path("statements").get(0).path("type").asText());
    }

    @Test
    void whenCallingListProcessors_shouldReturnDispatchKeys()
            throws Exception {
        callTool(50, "list_node_processors",
                objectMapper.createObjectNode());

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode processors = objectMapper.readTree(result
                .path("content").get(0).path("text").asText());
        assertEquals("VariableSetProcessor",
                processors.path("K2Node_VariableSet").asText());
    }

    // --- private helpers ---

    private void callTool(final int id, final String name,
            final ObjectNode arguments) throws Exception {
        final ObjectNode params = objectMapper.createObjectNode();
        params.put("name", name);
        params.set("arguments", arguments);

        final ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", "tools/call");
        request.set("params", params);

        send(objectMapper.writeValueAsString(request));
    }

    private void performHandshake() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                + "\"params\":{\"protocolVersion\":\"2024-11-05\","
                + "\"capabilities\":{},"
                + "\"clientInfo\":{\"name\":\"test-llm\","
                + "\"version\":\"1.0\"}}}");

        readJson(); // consume initialize response

        send("{\"jsonrpc\":\"2.0\","
                + "\"method\":\"notifications/initialized\","
                + "\"params\":{}}");

        // Brief pause to let the server register the initialized state
        Thread.sleep(50);
    }

    private void send(final String json) {
        clientWriter.println(json);
        clientWriter.flush();
    }

    private JsonNode readJson() throws Exception {
        final Future<String> future = responseReader.submit(
                clientReader::readLine);
        final String line = future.get(5, TimeUnit.SECONDS);
        assertNotNull(line, "Server did not respond within 5 seconds");
        return objectMapper.readTree(line);
    }

}
