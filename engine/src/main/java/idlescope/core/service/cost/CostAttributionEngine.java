package idlescope.core.service.cost;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import idlescope.core.config.CostConfig;
import idlescope.core.model.collect.PodPlacement;
import idlescope.core.model.collect.WorkloadMetrics;
import idlescope.core.model.cost.ClusterCostBreakdown;
import idlescope.core.model.cost.CostBreakdown;
import idlescope.core.model.cost.CostDriver;
import idlescope.core.model.cost.CostResult;
import idlescope.core.model.cost.CostUnavailableReason;
import idlescope.core.model.cost.NodeCostInfo;
import idlescope.core.model.cost.NodeShare;
import idlescope.core.model.workload.WorkloadKind;

/**
 * Attributes node cost to a workload by its share of node capacity.
 *
 * <p>For every replica, {@code allocation = cpuWeight * cpuRequest / allocatableCpu
 * + memoryWeight * memoryRequest / allocatableMemory}, clamped to [0, 1], and the
 * hourly share is the node's hourly cost times that allocation. Replicas on
 * the same node add up, again capped at the whole node. A cluster workload is
 * charged every node in full.
 *
 * <p>The engine never reports a zero cost for something it could not price:
 * a placement that cannot be resolved against the billed nodes makes the
 * whole result {@link CostUnavailableReason#NODE_UNRESOLVED}.
 */
@ApplicationScoped
public class CostAttributionEngine {

    private static final Logger LOG = Logger.getLogger(CostAttributionEngine.class);

    private final double cpuWeight;
    private final double memoryWeight;
    private final int hoursPerDay;
    private final int daysPerMonth;
    private final String currency;

    @Inject
    public CostAttributionEngine(CostConfig config) {
        this(config.cpuWeight(), config.memoryWeight(), config.hoursPerDay(), config.daysPerMonth(), config.currency());
    }

    public CostAttributionEngine(
            double cpuWeight, double memoryWeight, int hoursPerDay, int daysPerMonth, String currency) {
        this.cpuWeight = cpuWeight;
        this.memoryWeight = memoryWeight;
        this.hoursPerDay = hoursPerDay;
        this.daysPerMonth = daysPerMonth;
        this.currency = currency;
    }

    /**
     * Attribute cost to the measured workload.
     *
     * @param metrics       merged workload metrics
     * @param nodeCosts     price and capacity of the cluster's nodes
     * @param clusterCosts  cluster spend over the window, when the billing collaborator provided it
     */
    public CostResult attribute(
            WorkloadMetrics metrics, List<NodeCostInfo> nodeCosts, Optional<ClusterCostBreakdown> clusterCosts) {
        if (metrics.noData()) {
            return CostResult.unavailable(CostUnavailableReason.NO_METRICS, "No metrics collected for " + metrics.workload());
        }
        Map<String, NodeCostInfo> nodes = nodeCosts.stream()
                .collect(Collectors.toMap(NodeCostInfo::nodeName, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<Share> shares;
        if (metrics.workload().kind() == WorkloadKind.CLUSTER) {
            if (nodes.isEmpty()) {
                return CostResult.unavailable(CostUnavailableReason.NODE_UNRESOLVED, "Billing reported no nodes");
            }
            var weights = cpuWeight + memoryWeight;
            var cpuPart = weights > 0 ? cpuWeight / weights : 0.5;
            shares = nodes.values().stream()
                    .map(node -> new Share(node, cpuPart, 1.0 - cpuPart))
                    .toList();
        } else {
            var placements = metrics.effectivePlacements();
            if (placements.isEmpty()) {
                return CostResult.unavailable(
                        CostUnavailableReason.NODE_UNRESOLVED, "No node placement known for " + metrics.workload());
            }
            var unresolved = placements.stream()
                    .filter(p -> !p.isScheduled() || !nodes.containsKey(p.nodeName()))
                    .map(p -> p.podName() + (p.isScheduled() ? "@" + p.nodeName() : " (unscheduled)"))
                    .toList();
            if (!unresolved.isEmpty()) {
                LOG.warnf("Cannot price %s, unresolved placements: %s", metrics.workload(), unresolved);
                return CostResult.unavailable(
                        CostUnavailableReason.NODE_UNRESOLVED, "Unresolved placements: " + String.join(", ", unresolved));
            }
            shares = perNode(placements, nodes);
        }
        return CostResult.attributed(breakdown(metrics, shares, clusterCosts));
    }

    /**
     * Weighted, clamped allocation of one replica on its node.
     */
    public double allocationRatio(double cpuRequestCores, long memoryRequestBytes, NodeCostInfo node) {
        return clamp(cpuWeight * ratio(cpuRequestCores, node.allocatableCpu())
                + memoryWeight * ratio(memoryRequestBytes, node.allocatableMemory()));
    }

    private List<Share> perNode(List<PodPlacement> placements, Map<String, NodeCostInfo> nodes) {
        Map<String, double[]> weighted = new LinkedHashMap<>();
        for (var placement : placements) {
            var node = nodes.get(placement.nodeName());
            var cpu = cpuWeight * ratio(placement.cpuRequestCores(), node.allocatableCpu());
            var memory = memoryWeight * ratio(placement.memoryRequestBytes(), node.allocatableMemory());
            // each replica is clamped on its own before replicas on the same node add up
            var scale = scale(cpu + memory);
            var sums = weighted.computeIfAbsent(node.nodeName(), n -> new double[2]);
            sums[0] += cpu * scale;
            sums[1] += memory * scale;
        }
        var shares = new ArrayList<Share>();
        weighted.forEach((nodeName, sums) -> {
            var scale = scale(sums[0] + sums[1]);
            shares.add(new Share(nodes.get(nodeName), sums[0] * scale, sums[1] * scale));
        });
        return shares;
    }

    private CostBreakdown breakdown(
            WorkloadMetrics metrics, List<Share> shares, Optional<ClusterCostBreakdown> clusterCosts) {
        var hourly = shares.stream().mapToDouble(Share::hourlyCost).sum();
        var cpuHourly = shares.stream().mapToDouble(s -> s.node().hourlyCost() * s.cpu()).sum();
        var memoryHourly = shares.stream().mapToDouble(s -> s.node().hourlyCost() * s.memory()).sum();
        var nodesHourly = shares.stream().mapToDouble(s -> s.node().hourlyCost()).sum();

        double allocation;
        if (nodesHourly > 0) {
            allocation = clamp(hourly / nodesHourly);
        } else {
            allocation = clamp(shares.stream().mapToDouble(Share::allocation).average().orElse(0.0));
        }
        var nodeName = shares.stream()
                .max(Comparator.comparingDouble(Share::hourlyCost).thenComparingDouble(Share::allocation))
                .map(s -> s.node().nodeName())
                .orElse("");

        var daily = hourly * hoursPerDay;
        var monthly = daily * daysPerMonth;
        var clusterShare = clusterCosts
                .filter(c -> c.totalCost() > 0)
                .map(c -> clamp(hourly * c.range().hours() / c.totalCost()));
        var breakdownCurrency = clusterCosts.map(ClusterCostBreakdown::currency).orElse(currency);

        var drivers = List.of(
                new CostDriver("cpu", shares.stream().mapToDouble(Share::cpu).sum(), cpuHourly),
                new CostDriver("memory", shares.stream().mapToDouble(Share::memory).sum(), memoryHourly));
        var nodeShares = shares.stream()
                .map(s -> new NodeShare(s.node().nodeName(), s.allocation(), s.hourlyCost()))
                .toList();

        LOG.debugf(
                "Attributed %s: %.4f %s/h on %d node(s), allocation %.4f",
                metrics.workload(), hourly, breakdownCurrency, shares.size(), allocation);
        return new CostBreakdown(
                metrics.workload(),
                nodeName,
                allocation,
                hourly,
                daily,
                monthly,
                drivers,
                nodeShares,
                clusterShare,
                breakdownCurrency);
    }

    private static double ratio(double request, double allocatable) {
        if (request <= 0) {
            return 0.0;
        }
        // unknown capacity: a positive request is charged the whole resource
        return allocatable > 0 ? request / allocatable : 1.0;
    }

    private static double scale(double raw) {
        return raw > 1.0 ? 1.0 / raw : 1.0;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }

    /**
     * Weighted CPU and memory parts of one node's allocation, summing to at most 1.
     */
    private record Share(NodeCostInfo node, double cpu, double memory) {

        double allocation() {
            return Math.min(cpu + memory, 1.0);
        }

        double hourlyCost() {
            return node.hourlyCost() * allocation();
        }
    }
}
