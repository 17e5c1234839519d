package idlescope.adapter.out.collector;

import java.math.BigDecimal;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import idlescope.core.config.CollectionConfig;
import idlescope.core.config.CollectorsConfig;
import idlescope.core.model.collect.CollectorFailureKind;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Collector for a Prometheus-compatible query engine scraping cAdvisor metrics.
 *
 * <p>Usage is averaged over the whole window with instant queries evaluated
 * at the window end:
 * <pre>{@code
 * sum(rate(container_cpu_usage_seconds_total{namespace="shop",pod="web-1",container!=""}[3600s]))
 * sum(avg_over_time(container_memory_working_set_bytes{namespace="shop",pod="web-1",container!=""}[3600s]))
 * }</pre>
 *
 * <p>Enabled when {@code idlescope.collectors.prometheus.url} is set.
 */
@ApplicationScoped
public class PrometheusCollector extends AbstractWorkloadCollector {

    private static final Logger LOG = Logger.getLogger(PrometheusCollector.class);

    private static final long MIN_WINDOW_SECONDS = 60;

    private final WebClient webClient;
    private final Optional<String> baseUrl;
    private final long timeoutMs;

    @Inject
    public PrometheusCollector(Vertx vertx, CollectorsConfig collectors, CollectionConfig collection) {
        this.webClient = WebClient.create(vertx);
        this.baseUrl = collectors.prometheus().url().filter(url -> !url.isBlank()).map(PrometheusCollector::trimSlash);
        this.timeoutMs = collection.collectorTimeout().toMillis();
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.QUERY_ENGINE;
    }

    @Override
    public boolean supportsWorkloadMetrics() {
        return true;
    }

    @Override
    public boolean supportsNodeMetrics() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return baseUrl.isPresent();
    }

    @Override
    protected Uni<MetricsSnapshot> fetch(WorkloadIdentifier workload, TimeRange range) {
        var url = baseUrl.orElseThrow(() -> CollectorException.unavailable("Prometheus URL not configured"));
        var selector = selector(workload);
        var window = Math.max(MIN_WINDOW_SECONDS, range.duration().toSeconds()) + "s";
        var cpuQuery = "sum(rate(container_cpu_usage_seconds_total{" + selector + "}[" + window + "]))";
        var memoryQuery = "sum(avg_over_time(container_memory_working_set_bytes{" + selector + "}[" + window + "]))";
        var time = BigDecimal.valueOf(range.end().toEpochMilli()).movePointLeft(3).toPlainString();

        return Uni.combine()
                .all()
                .unis(query(url, cpuQuery, time), query(url, memoryQuery, time))
                .asTuple()
                .map(values -> MetricsSnapshot.builder()
                        .cpuUsageCores(values.getItem1().orElse(null))
                        .memoryUsageBytes(values.getItem2().map(Double::longValue).orElse(null))
                        .build());
    }

    static String selector(WorkloadIdentifier workload) {
        return switch (workload.kind()) {
            case POD -> "namespace=\"" + workload.namespace() + "\",pod=\"" + workload.name() + "\",container!=\"\"";
            case DEPLOYMENT -> "namespace=\"" + workload.namespace() + "\",pod=~\"" + workload.name()
                    + "-[a-z0-9]+-[a-z0-9]+\",container!=\"\"";
            case CLUSTER -> "container!=\"\"";
        };
    }

    private Uni<Optional<Double>> query(String url, String promql, String time) {
        LOG.debugf("Prometheus query at %s: %s", time, promql);
        return webClient
                .getAbs(url + "/api/v1/query")
                .timeout(timeoutMs)
                .putHeader("Accept", "application/json")
                .addQueryParam("query", promql)
                .addQueryParam("time", time)
                .send()
                .map(response -> {
                    if (response.statusCode() != 200) {
                        throw CollectorException.unavailable(
                                "Prometheus returned status " + response.statusCode() + " for " + promql);
                    }
                    return firstValue(response.bodyAsJsonObject());
                });
    }

    static Optional<Double> firstValue(JsonObject body) {
        if (body == null || !"success".equals(body.getString("status"))) {
            throw new CollectorException(CollectorFailureKind.ERROR, "Prometheus query did not succeed: " + body);
        }
        var result = PodSpecs.object(body, "data").getJsonArray("result");
        if (result == null || result.isEmpty()) {
            return Optional.empty();
        }
        var sample = result.getJsonObject(0).getJsonArray("value");
        if (sample == null || sample.size() < 2) {
            return Optional.empty();
        }
        return parseSample(sample);
    }

    private static Optional<Double> parseSample(JsonArray sample) {
        var value = Double.parseDouble(String.valueOf(sample.getValue(1)));
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
