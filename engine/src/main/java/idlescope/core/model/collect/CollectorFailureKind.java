package idlescope.core.model.collect;

/**
 * Why a collector produced no usable result.
 */
public enum CollectorFailureKind {
    /** Backend unreachable or returned an error status. */
    UNAVAILABLE,
    /** No result within the per-collector timeout. */
    TIMEOUT,
    /** The collector cannot answer for this workload kind. */
    UNSUPPORTED,
    /** The backend answered but the response could not be interpreted. */
    ERROR
}
