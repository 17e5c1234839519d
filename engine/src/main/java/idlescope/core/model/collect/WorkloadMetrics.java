package idlescope.core.model.collect;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Canonical metrics for one workload, merged from every successful source.
 *
 * <p>Each populated field carries a provenance tag naming the source whose
 * value is in effect. A record built with {@link #noData} means no source
 * could be measured, which consumers must not read as zero usage.
 *
 * @param workload          the measured workload
 * @param range             the query window
 * @param values            merged field values
 * @param provenance        winning source per populated field
 * @param successfulSources sources whose results took part in the merge
 * @param failures          sources that failed and were skipped
 * @param noData            true when every source failed
 */
public record WorkloadMetrics(
        WorkloadIdentifier workload,
        TimeRange range,
        MetricsSnapshot values,
        Map<MetricField, CollectorSource> provenance,
        List<CollectorSource> successfulSources,
        List<CollectorResult.Failure> failures,
        boolean noData) {

    public WorkloadMetrics {
        values = values == null ? MetricsSnapshot.empty() : values;
        provenance = provenance == null || provenance.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(provenance));
        successfulSources = successfulSources == null ? List.of() : List.copyOf(successfulSources);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * The explicit "could not measure" record.
     */
    public static WorkloadMetrics noData(
            WorkloadIdentifier workload, TimeRange range, List<CollectorResult.Failure> failures) {
        return new WorkloadMetrics(workload, range, MetricsSnapshot.empty(), Map.of(), List.of(), failures, true);
    }

    public Optional<CollectorSource> provenanceOf(MetricField field) {
        return Optional.ofNullable(provenance.get(field));
    }

    /**
     * Number of sources that were dispatched for this run.
     */
    public int dispatchedSources() {
        return successfulSources.size() + failures.size();
    }

    /**
     * Placements used for cost attribution.
     *
     * <p>Explicit replica placements win; otherwise a single placement is
     * derived from the workload-level node name and requests.
     */
    public List<PodPlacement> effectivePlacements() {
        var explicit = values.placements().orElse(List.of());
        if (!explicit.isEmpty()) {
            return explicit;
        }
        return values.nodeName()
                .map(node -> List.of(new PodPlacement(
                        workload.name(),
                        node,
                        values.cpuRequestCores().orElse(0.0),
                        values.memoryRequestBytes().orElse(0L))))
                .orElse(List.of());
    }
}
