package co.fanki.blueprintmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Blueprint MCP Server Application.
 *
 * <p>This is the main entry point for the Blueprint MCP Server, which turns
 * blueprint text dumps (copied graph nodes or widget layouts) into readable
 * markdown, over REST and as Model Context Protocol (MCP) tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class BlueprintMcpServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(BlueprintMcpServerApplication.class, args);
    }

}
