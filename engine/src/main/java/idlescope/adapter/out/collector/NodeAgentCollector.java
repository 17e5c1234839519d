package idlescope.adapter.out.collector;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import idlescope.adapter.out.kubernetes.KubernetesApiClient;
import idlescope.core.config.CollectorsConfig;
import idlescope.core.model.collect.CollectorFailureKind;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.ContainerUsage;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.model.workload.WorkloadKind;

/**
 * Collector reading the kubelet stats summary through the API server node proxy.
 *
 * <p>Answers for single pods only: the pod is looked up to find its node,
 * then {@code /api/v1/nodes/{node}/proxy/stats/summary} is searched for it.
 */
@ApplicationScoped
public class NodeAgentCollector extends AbstractWorkloadCollector {

    private final KubernetesApiClient api;
    private final boolean enabled;

    @Inject
    public NodeAgentCollector(KubernetesApiClient api, CollectorsConfig config) {
        this.api = api;
        this.enabled = config.nodeAgent().enabled();
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.NODE_AGENT;
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
    public boolean supports(WorkloadKind kind) {
        return kind == WorkloadKind.POD;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    protected Uni<MetricsSnapshot> fetch(WorkloadIdentifier workload, TimeRange range) {
        return api.getJson("/api/v1/namespaces/" + workload.namespace() + "/pods/" + workload.name())
                .flatMap(pod -> {
                    var node = PodSpecs.nodeName(pod);
                    if (node.isBlank()) {
                        throw CollectorException.unavailable("Pod " + workload + " is not scheduled");
                    }
                    return api.getJson("/api/v1/nodes/" + node + "/proxy/stats/summary")
                            .map(summary -> podStats(summary, workload, node, range));
                });
    }

    private static MetricsSnapshot podStats(
            JsonObject summary, WorkloadIdentifier workload, String node, TimeRange range) {
        var pods = summary.getJsonArray("pods");
        var stats = (pods == null ? List.<JsonObject>of() : PodSpecs.objects(pods)).stream()
                .filter(pod -> {
                    var ref = PodSpecs.object(pod, "podRef");
                    return workload.name().equals(ref.getString("name"))
                            && workload.namespace().equals(ref.getString("namespace"));
                })
                .findFirst()
                .orElseThrow(() -> CollectorException.unavailable("No kubelet stats for " + workload + " on " + node));

        var cpu = PodSpecs.object(stats, "cpu");
        if (!sampledWithin(cpu.getString("time"), range)) {
            throw CollectorException.unsupported("Kubelet sample of " + workload + " is outside the window");
        }
        var containers = stats.getJsonArray("containers");
        var usage = (containers == null ? List.<JsonObject>of() : PodSpecs.objects(containers)).stream()
                .map(c -> new ContainerUsage(
                        c.getString("name", ""),
                        nanoCores(PodSpecs.object(c, "cpu")),
                        workingSet(PodSpecs.object(c, "memory"))))
                .toList();
        return MetricsSnapshot.builder()
                .cpuUsageCores(cpu.getValue("usageNanoCores") == null ? null : nanoCores(cpu))
                .memoryUsageBytes(PodSpecs.object(stats, "memory").getLong("workingSetBytes"))
                .nodeName(node)
                .containerUsage(usage.isEmpty() ? null : usage)
                .build();
    }

    private static double nanoCores(JsonObject cpu) {
        var nanos = cpu.getLong("usageNanoCores");
        return nanos == null ? 0.0 : nanos / 1_000_000_000.0;
    }

    private static long workingSet(JsonObject memory) {
        var bytes = memory.getLong("workingSetBytes");
        return bytes == null ? 0L : bytes;
    }

    private static boolean sampledWithin(String time, TimeRange range) {
        if (time == null) {
            return true;
        }
        try {
            var sampled = Instant.parse(time);
            return !sampled.isBefore(range.start()) && sampled.isBefore(range.end().plusSeconds(60));
        } catch (DateTimeParseException e) {
            throw new CollectorException(CollectorFailureKind.ERROR, "Invalid kubelet sample time: " + time, e);
        }
    }
}
