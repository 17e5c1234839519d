package idlescope.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import idlescope.core.model.cost.ClusterCostBreakdown;
import idlescope.core.model.cost.NodeCostInfo;
import idlescope.core.model.workload.TimeRange;

/**
 * Port for the billing collaborator.
 *
 * <p>The engine treats the returned prices and capacities as authoritative for
 * the window and does not know which cloud backs them. Implementations handle
 * their own retries; a failed {@link Uni} is reported as cost-unavailable.
 */
public interface BillingClient {

    /**
     * Price and capacity of every node of a cluster.
     *
     * @param clusterId the cluster
     * @param range     the billed window
     * @return node costs
     */
    Uni<List<NodeCostInfo>> getNodeCosts(String clusterId, TimeRange range);

    /**
     * Total cluster spend over a window.
     *
     * @param range the billed window
     * @return cluster cost breakdown
     */
    Uni<ClusterCostBreakdown> getClusterCosts(TimeRange range);
}
