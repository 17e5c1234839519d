package idlescope.adapter.out.collector;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import idlescope.adapter.out.kubernetes.KubernetesApiClient;
import idlescope.core.model.collect.CollectorFailureKind;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.ContainerUsage;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.util.ResourceQuantity;

/**
 * Collector for the resource metrics API ({@code metrics.k8s.io/v1beta1}).
 *
 * <p>The API only serves the latest usage sample. Samples taken outside the
 * window are ignored, so a window in the past yields an unsupported result
 * rather than current usage.
 *
 * <p>Deployment replicas are matched by the {@code <deployment>-} pod name prefix.
 */
@ApplicationScoped
public class MetricsAggregatorCollector extends AbstractWorkloadCollector {

    static final String BASE_PATH = "/apis/metrics.k8s.io/v1beta1";

    // the latest sample may trail the window end by one scrape
    private static final Duration SAMPLE_TOLERANCE = Duration.ofMinutes(1);

    private final KubernetesApiClient api;

    @Inject
    public MetricsAggregatorCollector(KubernetesApiClient api) {
        this.api = api;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.AGGREGATOR;
    }

    @Override
    public boolean supportsWorkloadMetrics() {
        return true;
    }

    @Override
    protected Uni<MetricsSnapshot> fetch(WorkloadIdentifier workload, TimeRange range) {
        return switch (workload.kind()) {
            case POD -> api.getJson(BASE_PATH + "/namespaces/" + workload.namespace() + "/pods/" + workload.name())
                    .map(item -> usage(List.of(item), range, workload));
            case DEPLOYMENT -> api.getJson(BASE_PATH + "/namespaces/" + workload.namespace() + "/pods")
                    .map(list -> usage(
                            matching(list, name -> name.startsWith(workload.name() + "-")), range, workload));
            case CLUSTER -> api.getJson(BASE_PATH + "/pods").map(list -> usage(PodSpecs.items(list), range, workload));
        };
    }

    private static List<JsonObject> matching(JsonObject list, Predicate<String> podName) {
        return PodSpecs.items(list).stream()
                .filter(item -> podName.test(PodSpecs.name(item)))
                .toList();
    }

    private static MetricsSnapshot usage(List<JsonObject> items, TimeRange range, WorkloadIdentifier workload) {
        if (items.isEmpty()) {
            throw CollectorException.unavailable("No pod metrics for " + workload);
        }
        var inWindow = items.stream().filter(item -> sampledWithin(item, range)).toList();
        if (inWindow.isEmpty()) {
            throw CollectorException.unsupported("Latest usage sample of " + workload + " is outside the window");
        }

        var cpu = 0.0;
        var memory = 0L;
        Map<String, ContainerUsage> perContainer = new LinkedHashMap<>();
        for (var item : inWindow) {
            var containers = item.getJsonArray("containers");
            for (var container : containers == null ? List.<JsonObject>of() : PodSpecs.objects(containers)) {
                var usage = PodSpecs.object(container, "usage");
                var containerCpu = ResourceQuantity.tryCpuCores(usage.getString("cpu")).orElse(0.0);
                var containerMemory = ResourceQuantity.tryBytes(usage.getString("memory")).orElse(0L);
                cpu += containerCpu;
                memory += containerMemory;
                perContainer.merge(
                        container.getString("name", ""),
                        new ContainerUsage(container.getString("name", ""), containerCpu, containerMemory),
                        (a, b) -> new ContainerUsage(
                                a.container(), a.cpuCores() + b.cpuCores(), a.memoryBytes() + b.memoryBytes()));
            }
        }
        return MetricsSnapshot.builder()
                .cpuUsageCores(cpu)
                .memoryUsageBytes(memory)
                .containerUsage(List.copyOf(perContainer.values()))
                .build();
    }

    private static boolean sampledWithin(JsonObject item, TimeRange range) {
        var timestamp = item.getString("timestamp");
        if (timestamp == null) {
            return true;
        }
        try {
            var sampled = Instant.parse(timestamp);
            return !sampled.isBefore(range.start()) && sampled.isBefore(range.end().plus(SAMPLE_TOLERANCE));
        } catch (DateTimeParseException e) {
            throw new CollectorException(
                    CollectorFailureKind.ERROR, "Invalid sample timestamp: " + timestamp, e);
        }
    }
}
