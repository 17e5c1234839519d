package idlescope.core.service.collect;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.MetricField;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.collect.WorkloadMetrics;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Folds collector results into one {@link WorkloadMetrics} record.
 *
 * <p>Successful results are applied in source priority order. A later source
 * replaces a field only when it has a value for it, so the outcome does not
 * depend on the order in which results arrived. Values are never averaged
 * across sources.
 */
@ApplicationScoped
public class MetricsMerger {

    private static final Logger LOG = Logger.getLogger(MetricsMerger.class);

    private static final Comparator<CollectorResult> BY_PRIORITY =
            Comparator.comparingInt(r -> r.source().priority());

    public WorkloadMetrics merge(WorkloadIdentifier workload, TimeRange range, List<CollectorResult> results) {
        var failures = results.stream()
                .filter(CollectorResult.Failure.class::isInstance)
                .sorted(BY_PRIORITY)
                .map(CollectorResult.Failure.class::cast)
                .toList();
        var successes = results.stream()
                .filter(CollectorResult.Success.class::isInstance)
                .sorted(BY_PRIORITY)
                .map(CollectorResult.Success.class::cast)
                .toList();

        for (var failure : failures) {
            LOG.debugf("Skipping %s for %s: %s", failure.source().tag(), workload, failure.kind());
        }
        if (successes.isEmpty()) {
            LOG.warnf("No telemetry source could measure %s, reporting no data", workload);
            return WorkloadMetrics.noData(workload, range, failures);
        }

        Map<MetricField, CollectorSource> provenance = new EnumMap<>(MetricField.class);
        var merged = MetricsSnapshot.builder()
                .cpuRequestCores(pick(successes, MetricField.CPU_REQUEST, MetricsSnapshot::cpuRequestCores, provenance))
                .cpuLimitCores(pick(successes, MetricField.CPU_LIMIT, MetricsSnapshot::cpuLimitCores, provenance))
                .memoryRequestBytes(
                        pick(successes, MetricField.MEMORY_REQUEST, MetricsSnapshot::memoryRequestBytes, provenance))
                .memoryLimitBytes(
                        pick(successes, MetricField.MEMORY_LIMIT, MetricsSnapshot::memoryLimitBytes, provenance))
                .cpuUsageCores(pick(successes, MetricField.CPU_USAGE, MetricsSnapshot::cpuUsageCores, provenance))
                .memoryUsageBytes(
                        pick(successes, MetricField.MEMORY_USAGE, MetricsSnapshot::memoryUsageBytes, provenance))
                .nodeName(pick(successes, MetricField.NODE_NAME, MetricsSnapshot::nodeName, provenance))
                .placements(pick(successes, MetricField.PLACEMENTS, MetricsSnapshot::placements, provenance))
                .containerUsage(
                        pick(successes, MetricField.CONTAINER_USAGE, MetricsSnapshot::containerUsage, provenance))
                .logs(pick(successes, MetricField.LOGS, MetricsSnapshot::logs, provenance))
                .build();

        var sources = successes.stream().map(CollectorResult::source).toList();
        LOG.debugf("Merged %s for %s with provenance %s", sources, workload, provenance);
        return new WorkloadMetrics(workload, range, merged, provenance, sources, failures, false);
    }

    private static <T> T pick(
            List<CollectorResult.Success> ordered,
            MetricField field,
            Function<MetricsSnapshot, Optional<T>> accessor,
            Map<MetricField, CollectorSource> provenance) {
        T value = null;
        for (var result : ordered) {
            var candidate = accessor.apply(result.snapshot());
            if (candidate.isPresent()) {
                value = candidate.get();
                provenance.put(field, result.source());
            }
        }
        return value;
    }
}
