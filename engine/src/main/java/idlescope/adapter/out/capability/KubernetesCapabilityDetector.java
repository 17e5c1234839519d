package idlescope.adapter.out.capability;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import idlescope.adapter.out.kubernetes.KubernetesApiClient;
import idlescope.core.config.CollectionConfig;
import idlescope.core.config.CollectorsConfig;
import idlescope.core.model.collect.CloudProviderKind;
import idlescope.core.model.collect.ClusterCapabilities;
import idlescope.core.port.out.ClusterCapabilityDetector;

/**
 * Detects optional telemetry backends of the connected cluster.
 *
 * <ul>
 *   <li>Metrics aggregator: {@code GET /apis/metrics.k8s.io/v1beta1} answers 200</li>
 *   <li>Query engine: the configured Prometheus answers 200 on {@code /-/ready}</li>
 *   <li>Cloud provider: node {@code spec.providerID} prefix, else node naming conventions</li>
 * </ul>
 *
 * <p>Probes for optional backends report absence on failure. Failing to list
 * nodes fails detection, so that an unreachable API server is not cached as a
 * cluster without capabilities.
 */
@ApplicationScoped
public class KubernetesCapabilityDetector implements ClusterCapabilityDetector {

    private static final Logger LOG = Logger.getLogger(KubernetesCapabilityDetector.class);

    private final KubernetesApiClient api;
    private final WebClient webClient;
    private final Optional<String> prometheusUrl;
    private final long timeoutMs;

    @Inject
    public KubernetesCapabilityDetector(
            KubernetesApiClient api, Vertx vertx, CollectorsConfig collectors, CollectionConfig collection) {
        this.api = api;
        this.webClient = WebClient.create(vertx);
        this.prometheusUrl = collectors.prometheus().url().filter(url -> !url.isBlank());
        this.timeoutMs = collection.collectorTimeout().toMillis();
    }

    @Override
    public Uni<ClusterCapabilities> detect(String clusterId) {
        var aggregator = api.probe("/apis/metrics.k8s.io/v1beta1")
                .map(status -> status == 200)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Metrics aggregator probe failed for %s: %s", clusterId, error.getMessage());
                    return false;
                });
        var queryEngine = queryEngineReady(clusterId);
        var cloud = api.getJson("/api/v1/nodes", Map.of("limit", "50")).map(KubernetesCapabilityDetector::cloudProvider);

        return Uni.combine()
                .all()
                .unis(aggregator, queryEngine, cloud)
                .asTuple()
                .map(found -> new ClusterCapabilities(found.getItem1(), found.getItem2(), found.getItem3(), Instant.now()))
                .invoke(capabilities -> LOG.infof(
                        "Detected capabilities of cluster %s: aggregator=%s, queryEngine=%s, cloud=%s",
                        clusterId,
                        capabilities.hasMetricsAggregator(),
                        capabilities.hasQueryEngine(),
                        capabilities.cloudProvider()));
    }

    private Uni<Boolean> queryEngineReady(String clusterId) {
        if (prometheusUrl.isEmpty()) {
            return Uni.createFrom().item(false);
        }
        var url = prometheusUrl.get();
        return webClient
                .getAbs((url.endsWith("/") ? url.substring(0, url.length() - 1) : url) + "/-/ready")
                .timeout(timeoutMs)
                .send()
                .map(response -> response.statusCode() == 200)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Query engine probe failed for %s: %s", clusterId, error.getMessage());
                    return false;
                });
    }

    static CloudProviderKind cloudProvider(JsonObject nodeList) {
        var items = nodeList.getJsonArray("items");
        if (items == null) {
            return CloudProviderKind.NONE;
        }
        var byNodeName = CloudProviderKind.NONE;
        for (var item : items) {
            if (!(item instanceof JsonObject node)) {
                continue;
            }
            var fromProvider = CloudProviderKind.fromProviderId(
                    node.getJsonObject("spec", new JsonObject()).getString("providerID"));
            if (fromProvider.isCloud()) {
                return fromProvider;
            }
            if (!byNodeName.isCloud()) {
                byNodeName = CloudProviderKind.fromNodeName(
                        node.getJsonObject("metadata", new JsonObject()).getString("name"));
            }
        }
        return byNodeName;
    }
}
