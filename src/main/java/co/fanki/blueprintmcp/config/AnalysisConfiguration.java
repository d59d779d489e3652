package co.fanki.blueprintmcp.config;

import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.ProcessorRegistry;
import co.fanki.blueprintmcp.analysis.domain.processor.StandardProcessors;
import co.fanki.blueprintmcp.graph.domain.GraphBuilder;
import co.fanki.blueprintmcp.parsing.domain.RawObjectParser;
import co.fanki.blueprintmcp.widget.domain.WidgetTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework free pipeline classes as beans.
 *
 * <p>All of them are stateless between calls, so single instances are
 * shared by every request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisConfiguration.class);

    @Bean
    RawObjectParser rawObjectParser() {
        return new RawObjectParser();
    }

    @Bean
    GraphBuilder graphBuilder() {
        return new GraphBuilder();
    }

    @Bean
    WidgetTreeBuilder widgetTreeBuilder() {
        return new WidgetTreeBuilder();
    }

    /**
     * Creates the registry with every built in processor.
     *
     * @return the processor registry
     */
    @Bean
    ProcessorRegistry processorRegistry() {
        final ProcessorRegistry registry = StandardProcessors.create();
        LOG.info("Registered {} specialized node processors",
                registry.describe().size());
        return registry;
    }

    /**
     * Creates the analyzer.
     *
     * @param registry the processor registry
     * @param maxNodeVisits the node visit budget per entry point
     * @return the graph analyzer
     */
    @Bean
    GraphAnalyzer graphAnalyzer(final ProcessorRegistry registry,
            @Value("${blueprint.analysis.max-node-visits:10000}")
            final int maxNodeVisits) {
        return new GraphAnalyzer(registry, maxNodeVisits);
    }

}
