package idlescope.core.model.cost;

import java.util.Map;

import idlescope.core.model.workload.TimeRange;

/**
 * Cluster-wide spend over a window.
 *
 * @param clusterId    cluster the costs belong to
 * @param totalCost    total spend over {@code range}
 * @param currency     ISO currency code
 * @param range        billed window
 * @param serviceCosts spend per billed service (compute, control plane, ...)
 */
public record ClusterCostBreakdown(
        String clusterId, double totalCost, String currency, TimeRange range, Map<String, Double> serviceCosts) {

    public ClusterCostBreakdown {
        serviceCosts = serviceCosts == null ? Map.of() : Map.copyOf(serviceCosts);
    }
}
