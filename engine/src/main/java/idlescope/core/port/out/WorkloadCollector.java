package idlescope.core.port.out;

import io.smallrye.mutiny.Uni;

import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.model.workload.WorkloadKind;

/**
 * Port for fetching workload metrics from exactly one telemetry source.
 *
 * <p>Implementations declare statically which kinds of query they answer; the
 * registry filters on these declarations before dispatch. A collector must not
 * fail its {@link Uni} for backend problems: an unreachable backend yields a
 * {@link CollectorResult.Failure}. The registry still guards against
 * implementations that break this rule.
 */
public interface WorkloadCollector {

    /**
     * The source this collector reads from; at most one collector per source is active.
     */
    CollectorSource source();

    /**
     * Whether the collector returns workload-level resource or usage data.
     */
    boolean supportsWorkloadMetrics();

    /**
     * Whether the collector returns node-level data.
     */
    default boolean supportsNodeMetrics() {
        return false;
    }

    /**
     * Whether the collector returns raw request logs.
     */
    default boolean supportsLogs() {
        return false;
    }

    /**
     * Whether the collector can answer for workloads of the given kind.
     */
    default boolean supports(WorkloadKind kind) {
        return true;
    }

    /**
     * Whether the collector is configured and ready to use.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Collect metrics for a workload.
     *
     * @param workload the workload to measure
     * @param range    the window to query, results are clipped to it
     * @return the collector result, possibly partial or a typed failure
     */
    Uni<CollectorResult> collect(WorkloadIdentifier workload, TimeRange range);
}
