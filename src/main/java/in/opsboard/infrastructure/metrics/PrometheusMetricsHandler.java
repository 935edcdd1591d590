package in.opsboard.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves the realtime registry at /metrics.
 *
 * The exposition format follows the scraper's Accept header (Prometheus text or OpenMetrics).
 * Repeated {@code name[]} query parameters restrict the output to those families, e.g.
 * {@code /metrics?name[]=realtime_connections}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedFamilies(exchange);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] scrape failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("metrics unavailable");
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString());
        log.trace("[METRICS] scrape served {} chars{}", writer.getBuffer().length(),
            names.isEmpty() ? "" : " for " + names);
    }

    private static Set<String> requestedFamilies(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
