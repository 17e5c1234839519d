package idlescope.core.model.workload;

/**
 * The granularity of the subject being assessed.
 */
public enum WorkloadKind {
    POD,
    DEPLOYMENT,
    CLUSTER
}
