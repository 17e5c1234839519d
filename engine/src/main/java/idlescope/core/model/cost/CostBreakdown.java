package idlescope.core.model.cost;

import java.util.List;
import java.util.Optional;

import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Cost attributed to a workload for one pipeline run.
 *
 * @param workload          the workload
 * @param nodeName          node carrying the largest share
 * @param allocationRatio   attributed fraction of the involved nodes' cost, in [0, 1]
 * @param hourlyCost        attributed cost per hour
 * @param dailyCost         attributed cost per day
 * @param monthlyProjection projected monthly cost
 * @param costDrivers       split of the hourly cost by resource
 * @param nodeShares        per-node shares, one per involved node
 * @param clusterShare      fraction of cluster spend over the window, when known
 * @param currency          ISO currency code
 */
public record CostBreakdown(
        WorkloadIdentifier workload,
        String nodeName,
        double allocationRatio,
        double hourlyCost,
        double dailyCost,
        double monthlyProjection,
        List<CostDriver> costDrivers,
        List<NodeShare> nodeShares,
        Optional<Double> clusterShare,
        String currency) {

    public CostBreakdown {
        if (allocationRatio < 0.0 || allocationRatio > 1.0) {
            throw new IllegalArgumentException("allocationRatio must be within [0, 1], got: " + allocationRatio);
        }
        costDrivers = costDrivers == null ? List.of() : List.copyOf(costDrivers);
        nodeShares = nodeShares == null ? List.of() : List.copyOf(nodeShares);
        clusterShare = clusterShare == null ? Optional.empty() : clusterShare;
    }
}
