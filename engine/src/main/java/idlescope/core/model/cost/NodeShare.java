package idlescope.core.model.cost;

/**
 * Share of one node's cost attributed to the workload.
 */
public record NodeShare(String nodeName, double allocationRatio, double hourlyCost) {}
