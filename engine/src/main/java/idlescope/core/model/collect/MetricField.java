package idlescope.core.model.collect;

/**
 * Individually mergeable fields of a metrics record.
 */
public enum MetricField {
    CPU_REQUEST,
    CPU_LIMIT,
    MEMORY_REQUEST,
    MEMORY_LIMIT,
    CPU_USAGE,
    MEMORY_USAGE,
    NODE_NAME,
    PLACEMENTS,
    CONTAINER_USAGE,
    LOGS
}
