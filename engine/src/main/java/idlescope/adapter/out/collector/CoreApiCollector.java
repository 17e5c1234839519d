package idlescope.adapter.out.collector;

import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import idlescope.adapter.out.kubernetes.KubernetesApiClient;
import idlescope.core.config.CollectionConfig;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Collector backed by the Kubernetes API server itself.
 *
 * <p>Always available. Reports resource requests and limits, node placement
 * of every replica, and container logs fetched with {@code timestamps=true}
 * from the start of the window. Logs are read from at most
 * {@code max-log-pods} replicas, each capped at {@code max-log-bytes}, and
 * only from the serving container of each replica (see
 * {@link PodSpecs#servingContainer}); sidecar traffic is not read.
 */
@ApplicationScoped
public class CoreApiCollector extends AbstractWorkloadCollector {

    private static final Logger LOG = Logger.getLogger(CoreApiCollector.class);

    private final KubernetesApiClient api;
    private final long maxLogBytes;
    private final int maxLogPods;

    @Inject
    public CoreApiCollector(KubernetesApiClient api, CollectionConfig config) {
        this.api = api;
        this.maxLogBytes = config.maxLogBytes();
        this.maxLogPods = config.maxLogPods();
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.CORE_API;
    }

    @Override
    public boolean supportsWorkloadMetrics() {
        return true;
    }

    @Override
    public boolean supportsLogs() {
        return true;
    }

    @Override
    protected Uni<MetricsSnapshot> fetch(WorkloadIdentifier workload, TimeRange range) {
        return switch (workload.kind()) {
            case POD -> api.getJson(podPath(workload.namespace(), workload.name()))
                    .flatMap(pod -> withLogs(workload.namespace(), List.of(pod), range));
            case DEPLOYMENT -> deploymentPods(workload)
                    .flatMap(pods -> withLogs(workload.namespace(), pods, range));
            case CLUSTER -> api.getJson("/api/v1/pods", Map.of("fieldSelector", "status.phase=Running"))
                    .map(list -> PodSpecs.snapshot(PodSpecs.items(list)).build());
        };
    }

    private Uni<List<JsonObject>> deploymentPods(WorkloadIdentifier workload) {
        var namespace = workload.namespace();
        return api.getJson("/apis/apps/v1/namespaces/" + namespace + "/deployments/" + workload.name())
                .flatMap(deployment -> {
                    var selector = labelSelector(deployment);
                    if (selector.isEmpty()) {
                        throw CollectorException.unsupported(
                                "Deployment " + workload.name() + " has no matchLabels selector");
                    }
                    return api.getJson(
                            "/api/v1/namespaces/" + namespace + "/pods", Map.of("labelSelector", selector.get()));
                })
                .map(list -> PodSpecs.items(list).stream().filter(PodSpecs::isActive).toList());
    }

    private Uni<MetricsSnapshot> withLogs(String namespace, List<JsonObject> pods, TimeRange range) {
        var snapshot = PodSpecs.snapshot(pods);
        var logged = pods.stream()
                .filter(pod -> !PodSpecs.nodeName(pod).isBlank())
                .limit(maxLogPods)
                .toList();
        if (logged.isEmpty()) {
            return Uni.createFrom().item(snapshot.build());
        }
        var fetches = logged.stream().map(pod -> logs(namespace, pod, range)).toList();
        return Uni.join().all(fetches).andFailFast().map(payloads -> {
            var fetched = payloads.stream().flatMap(Optional::stream).toList();
            // logs stay absent unless at least one replica answered
            return snapshot.logs(fetched.isEmpty() ? null : String.join("\n", fetched)).build();
        });
    }

    private Uni<Optional<String>> logs(String namespace, JsonObject pod, TimeRange range) {
        var podName = PodSpecs.name(pod);
        var query = new LinkedHashMap<String, String>();
        query.put("timestamps", "true");
        query.put("sinceTime", range.start().truncatedTo(ChronoUnit.SECONDS).toString());
        query.put("limitBytes", String.valueOf(maxLogBytes));
        PodSpecs.servingContainer(pod).ifPresent(container -> query.put("container", container));
        return api.getText(podPath(namespace, podName) + "/log", query)
                .map(Optional::of)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Logs unavailable for pod %s/%s: %s", namespace, podName, error.getMessage());
                    return Optional.empty();
                });
    }

    private static Optional<String> labelSelector(JsonObject deployment) {
        var matchLabels = PodSpecs.object(PodSpecs.object(deployment, "spec"), "selector").getJsonObject("matchLabels");
        if (matchLabels == null || matchLabels.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(matchLabels.stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .sorted()
                .collect(Collectors.joining(",")));
    }

    private static String podPath(String namespace, String name) {
        return "/api/v1/namespaces/" + namespace + "/pods/" + name;
    }
}
