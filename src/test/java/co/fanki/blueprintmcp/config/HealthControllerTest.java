package co.fanki.blueprintmcp.config;

import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.processor.StandardProcessors;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for HealthController.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HealthControllerTest {

    @Test
    void whenCheckingHealth_shouldReportStatusAndProcessorCount() {
        final GraphAnalyzer analyzer = new GraphAnalyzer(
                StandardProcessors.create(),
                GraphAnalyzer.DEFAULT_MAX_NODE_VISITS);

        final Map<String, Object> health =
                new HealthController(analyzer).health();

        assertEquals("up", health.get("status"));
        assertEquals(analyzer.registry().describe().size(),
                health.get("nodeProcessors"));
    }

    @Test
    void whenCreating_givenNoAnalyzer_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new HealthController(null));
    }

}
