package idlescope.adapter.out.billing;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import idlescope.adapter.out.kubernetes.KubernetesApiClient;
import idlescope.core.config.BillingConfig;
import idlescope.core.config.CostConfig;
import idlescope.core.config.KubernetesConfig;
import idlescope.core.model.cost.ClusterCostBreakdown;
import idlescope.core.model.cost.NodeCostInfo;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.port.out.BillingClient;
import idlescope.core.util.ResourceQuantity;

/**
 * Billing adapter pricing nodes from a configured price table.
 *
 * <p>Node capacity comes from {@code status.allocatable} of every node; the
 * hourly price is looked up by the node's instance-type label and falls back
 * to the default price. Cluster spend is the sum of node prices over the window.
 */
@ApplicationScoped
public class KubernetesPricingBillingClient implements BillingClient {

    private static final Logger LOG = Logger.getLogger(KubernetesPricingBillingClient.class);

    static final String INSTANCE_TYPE_LABEL = "node.kubernetes.io/instance-type";
    static final String LEGACY_INSTANCE_TYPE_LABEL = "beta.kubernetes.io/instance-type";

    private final KubernetesApiClient api;
    private final BillingConfig billing;
    private final String clusterId;
    private final String currency;

    @Inject
    public KubernetesPricingBillingClient(
            KubernetesApiClient api, BillingConfig billing, KubernetesConfig kubernetes, CostConfig cost) {
        this.api = api;
        this.billing = billing;
        this.clusterId = kubernetes.clusterId();
        this.currency = cost.currency();
    }

    @Override
    public Uni<List<NodeCostInfo>> getNodeCosts(String clusterId, TimeRange range) {
        if (!this.clusterId.equals(clusterId)) {
            return Uni.createFrom().failure(new BillingException("No billing data for cluster " + clusterId));
        }
        return nodes();
    }

    @Override
    public Uni<ClusterCostBreakdown> getClusterCosts(TimeRange range) {
        return nodes().map(nodes -> {
            var hourly = nodes.stream().mapToDouble(NodeCostInfo::hourlyCost).sum();
            var total = hourly * range.hours();
            return new ClusterCostBreakdown(clusterId, total, currency, range, Map.of("compute", total));
        });
    }

    private Uni<List<NodeCostInfo>> nodes() {
        return api.getJson("/api/v1/nodes")
                .map(this::parseNodes)
                .onFailure(error -> !(error instanceof BillingException))
                .transform(error -> new BillingException("Cannot list nodes: " + error.getMessage(), error));
    }

    private List<NodeCostInfo> parseNodes(JsonObject list) {
        var items = list.getJsonArray("items");
        if (items == null) {
            throw new BillingException("Node list has no items");
        }
        return items.stream()
                .filter(JsonObject.class::isInstance)
                .map(JsonObject.class::cast)
                .map(this::nodeCost)
                .toList();
    }

    NodeCostInfo nodeCost(JsonObject node) {
        var metadata = node.getJsonObject("metadata", new JsonObject());
        var name = metadata.getString("name", "");
        var labels = metadata.getJsonObject("labels", new JsonObject());
        var instanceType = labels.getString(INSTANCE_TYPE_LABEL, labels.getString(LEGACY_INSTANCE_TYPE_LABEL));
        var allocatable = node.getJsonObject("status", new JsonObject()).getJsonObject("allocatable", new JsonObject());

        var price = instanceType == null ? null : billing.instancePrices().get(instanceType);
        if (price == null) {
            LOG.debugf("No price for node %s (instance type %s), using default", name, instanceType);
            price = billing.defaultHourlyPrice();
        }
        return new NodeCostInfo(
                name,
                price,
                ResourceQuantity.tryCpuCores(allocatable.getString("cpu")).orElse(0.0),
                ResourceQuantity.tryBytes(allocatable.getString("memory")).orElse(0L));
    }
}
