package co.fanki.blueprintmcp.config;

import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.shared.Preconditions;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for the blueprint server.
 *
 * <p>Besides the status it reports how many node kinds the analyzer has a
 * dedicated processor for, so a client can tell which registry it is
 * talking to.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final GraphAnalyzer graphAnalyzer;

    /**
     * Creates the controller.
     *
     * @param theGraphAnalyzer the analyzer whose registry is reported
     */
    public HealthController(final GraphAnalyzer theGraphAnalyzer) {
        graphAnalyzer = Preconditions.requireNonNull(theGraphAnalyzer,
                "The graph analyzer cannot be null");
    }

    /**
     * Tells that the server accepts requests.
     *
     * @return the status, "up", and the number of dedicated node processors
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        final Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "up");
        health.put("nodeProcessors", graphAnalyzer.registry().describe()
                .size());
        return health;
    }

}
