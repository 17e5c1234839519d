package idlescope.adapter.out.collector;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import idlescope.core.config.CollectionConfig;
import idlescope.core.config.CollectorsConfig;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.ContainerUsage;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.model.workload.WorkloadKind;

/**
 * Collector for a cloud provider telemetry bridge.
 *
 * <p>The bridge normalizes provider monitoring APIs into one JSON shape.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET /v1/workloads/pod/shop/web-1?start=2024-01-01T00:00:00Z&end=2024-01-01T01:00:00Z
 * GET /v1/workloads/cluster/prod?start=...&end=...
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "cpuUsageCores": 0.12,
 *   "memoryUsageBytes": 268435456,
 *   "nodeName": "gke-pool-1-abc",
 *   "containers": [{"name": "app", "cpuCores": 0.12, "memoryBytes": 268435456}]
 * }
 * }</pre>
 */
@ApplicationScoped
public class CloudTelemetryCollector extends AbstractWorkloadCollector {

    private static final Logger LOG = Logger.getLogger(CloudTelemetryCollector.class);

    private final WebClient webClient;
    private final Optional<String> baseUrl;
    private final long timeoutMs;

    @Inject
    public CloudTelemetryCollector(Vertx vertx, CollectorsConfig collectors, CollectionConfig collection) {
        this.webClient = WebClient.create(vertx);
        this.baseUrl = collectors.cloudTelemetry().url()
                .filter(url -> !url.isBlank())
                .map(url -> url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        this.timeoutMs = collection.collectorTimeout().toMillis();
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.CLOUD_TELEMETRY;
    }

    @Override
    public boolean supportsWorkloadMetrics() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return baseUrl.isPresent();
    }

    @Override
    protected Uni<MetricsSnapshot> fetch(WorkloadIdentifier workload, TimeRange range) {
        var url = baseUrl.orElseThrow(() -> CollectorException.unavailable("Cloud telemetry URL not configured"));
        var path = workload.kind() == WorkloadKind.CLUSTER
                ? "/v1/workloads/cluster/" + workload.name()
                : "/v1/workloads/" + workload.kind().name().toLowerCase(Locale.ROOT) + "/" + workload.namespace() + "/"
                        + workload.name();
        LOG.debugf("Cloud telemetry request: %s%s", url, path);
        return webClient
                .getAbs(url + path)
                .timeout(timeoutMs)
                .putHeader("Accept", "application/json")
                .addQueryParam("start", range.start().toString())
                .addQueryParam("end", range.end().toString())
                .send()
                .map(response -> {
                    if (response.statusCode() == 404) {
                        throw CollectorException.unavailable("Cloud telemetry has no data for " + workload);
                    }
                    if (response.statusCode() != 200) {
                        throw CollectorException.unavailable(
                                "Cloud telemetry returned status " + response.statusCode());
                    }
                    return parse(response.bodyAsJsonObject());
                });
    }

    static MetricsSnapshot parse(JsonObject body) {
        if (body == null) {
            throw CollectorException.unavailable("Cloud telemetry returned an empty body");
        }
        var containers = body.getJsonArray("containers");
        var usage = (containers == null ? List.<JsonObject>of() : PodSpecs.objects(containers)).stream()
                .map(c -> new ContainerUsage(
                        c.getString("name", ""),
                        c.getDouble("cpuCores", 0.0),
                        c.getLong("memoryBytes", 0L)))
                .toList();
        return MetricsSnapshot.builder()
                .cpuUsageCores(body.getDouble("cpuUsageCores"))
                .memoryUsageBytes(body.getLong("memoryUsageBytes"))
                .nodeName(body.getString("nodeName"))
                .containerUsage(usage.isEmpty() ? null : usage)
                .build();
    }
}
