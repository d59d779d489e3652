package co.fanki.blueprintmcp.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Blueprint MCP Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Describes the REST API.
     *
     * @return the OpenAPI description
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Blueprint MCP Server API")
                        .description("""
                                Blueprint MCP Server - turns copied blueprint nodes and widget
                                layouts into markdown that people and AI assistants can read.

                                ## Features
                                - **Event graphs**: pseudocode per event, with branches, loops and latent callbacks
                                - **Widget layouts**: the widget hierarchy with its key properties
                                - **Logical tree**: the analyzed structure as JSON

                                ## MCP Tools
                                - `render_blueprint` - Render a dump as markdown
                                - `analyze_blueprint` - Return the logical tree of an event graph
                                - `list_node_processors` - List the node kinds with a specialized processor
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
