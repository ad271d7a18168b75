package in.heauton.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Serves the registry in Prometheus text format at /metrics.
 *
 * {@code beforeScrape} runs on every request so sampled values (cache
 * occupancy) are fresh.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;
    private final Runnable beforeScrape;

    public PrometheusMetricsHandler(CollectorRegistry registry, Runnable beforeScrape) {
        this.registry = registry;
        this.beforeScrape = beforeScrape;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            beforeScrape.run();

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String output = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(output);
            log.debug("Served metrics ({} bytes)", output.length());

        } catch (IOException e) {
            log.error("Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
