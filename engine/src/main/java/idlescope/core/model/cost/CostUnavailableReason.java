package idlescope.core.model.cost;

public enum CostUnavailableReason {
    /** The workload's node could not be resolved against billing data. */
    NODE_UNRESOLVED,
    /** The billing collaborator failed or timed out. */
    BILLING_UNREACHABLE,
    /** No metrics were collected, so there is nothing to attribute. */
    NO_METRICS
}
