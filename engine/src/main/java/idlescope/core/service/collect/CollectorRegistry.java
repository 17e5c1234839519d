package idlescope.core.service.collect;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import idlescope.core.config.CollectionConfig;
import idlescope.core.model.collect.ClusterCapabilities;
import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.workload.ExecutionContext;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.model.workload.WorkloadKind;
import idlescope.core.port.out.AssessmentMetrics;
import idlescope.core.port.out.WorkloadCollector;

/**
 * Selects the collectors applicable to a cluster and runs them concurrently.
 *
 * <p>Discovers all {@link WorkloadCollector} beans via CDI. Exactly one
 * collector per {@link CollectorSource} is kept; when several are
 * registered for the same source the first one wins and the rest are logged
 * and ignored. The core API collector must be present.
 *
 * <p>Every dispatched collector runs under its own timeout, so a run waits at
 * most one timeout for the collection stage regardless of how many sources
 * hang. A collector that fails its {@link Uni}, throws or times out becomes a
 * typed {@link CollectorResult.Failure}; nothing is retried.
 */
@ApplicationScoped
public class CollectorRegistry {

    private static final Logger LOG = Logger.getLogger(CollectorRegistry.class);

    private final List<WorkloadCollector> collectors;
    private final CapabilityCache capabilityCache;
    private final Duration collectorTimeout;
    private final AssessmentMetrics metrics;

    @Inject
    public CollectorRegistry(
            Instance<WorkloadCollector> collectors,
            CapabilityCache capabilityCache,
            CollectionConfig config,
            AssessmentMetrics metrics) {
        this(collectors.stream().toList(), capabilityCache, config.collectorTimeout(), metrics);
    }

    public CollectorRegistry(
            List<WorkloadCollector> collectors,
            CapabilityCache capabilityCache,
            Duration collectorTimeout,
            AssessmentMetrics metrics) {
        this.collectors = onePerSource(collectors);
        this.capabilityCache = capabilityCache;
        this.collectorTimeout = collectorTimeout;
        this.metrics = metrics;

        if (this.collectors.stream().noneMatch(c -> c.source() == CollectorSource.CORE_API)) {
            throw new IllegalStateException("No core API collector registered");
        }
        LOG.infov(
                "Registered collectors: {0}",
                this.collectors.stream()
                        .map(c -> c.source().tag() + (c.isEnabled() ? "" : " (disabled)"))
                        .toList());
    }

    /**
     * All registered collectors in priority order, enabled or not.
     */
    public List<WorkloadCollector> registeredCollectors() {
        return collectors;
    }

    /**
     * Collect from every collector applicable to the workload's cluster.
     *
     * @return one result per dispatched collector, in priority order
     */
    public Uni<List<CollectorResult>> collect(
            WorkloadIdentifier workload, TimeRange range, ExecutionContext context) {
        return capabilityCache
                .get(context.clusterId())
                .flatMap(capabilities -> dispatch(select(capabilities, workload.kind()), workload, range));
    }

    /**
     * Collectors to dispatch for the given capabilities and workload kind, in priority order.
     */
    public List<WorkloadCollector> select(ClusterCapabilities capabilities, WorkloadKind kind) {
        return collectors.stream()
                .filter(c -> isBackedBy(c.source(), capabilities))
                .filter(c -> c.source() == CollectorSource.CORE_API || c.isEnabled())
                .filter(c -> c.supportsWorkloadMetrics() || c.supportsLogs())
                .filter(c -> c.supports(kind))
                .toList();
    }

    Uni<List<CollectorResult>> dispatch(
            List<WorkloadCollector> selected, WorkloadIdentifier workload, TimeRange range) {
        if (selected.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        LOG.debugf(
                "Dispatching %s for %s",
                selected.stream().map(c -> c.source().tag()).toList(), workload);
        var calls = selected.stream().map(c -> guarded(c, workload, range)).toList();
        return Uni.join().all(calls).andCollectFailures();
    }

    private Uni<CollectorResult> guarded(WorkloadCollector collector, WorkloadIdentifier workload, TimeRange range) {
        var source = collector.source();
        return Uni.createFrom().deferred(() -> {
            var started = System.nanoTime();
            return Uni.createFrom()
                    .deferred(() -> collector.collect(workload, range))
                    .ifNoItem()
                    .after(collectorTimeout)
                    .recoverWithItem(() -> CollectorResult.timeout(source, "No result within " + collectorTimeout))
                    .onFailure()
                    .recoverWithItem(error -> CollectorResult.error(source, describe(error)))
                    .onItem()
                    .ifNull()
                    .continueWith(() -> CollectorResult.error(source, "Collector returned no result"))
                    .invoke(result -> record(result, workload, (System.nanoTime() - started) / 1_000_000));
        });
    }

    private void record(CollectorResult result, WorkloadIdentifier workload, long latencyMs) {
        if (result instanceof CollectorResult.Failure failure) {
            LOG.warnf(
                    "Collector %s failed for %s after %dms: %s %s",
                    failure.source().tag(), workload, latencyMs, failure.kind(), failure.message());
        } else {
            LOG.debugf("Collector %s answered for %s in %dms", result.source().tag(), workload, latencyMs);
        }
        metrics.recordCollectorResult(result, latencyMs);
    }

    private static boolean isBackedBy(CollectorSource source, ClusterCapabilities capabilities) {
        return switch (source) {
            case CORE_API -> true;
            case AGGREGATOR -> capabilities.hasMetricsAggregator();
            case QUERY_ENGINE -> capabilities.hasQueryEngine();
            // gated by its own configuration through isEnabled()
            case NODE_AGENT -> true;
            case CLOUD_TELEMETRY -> capabilities.cloudProvider().isCloud();
        };
    }

    private static List<WorkloadCollector> onePerSource(List<WorkloadCollector> candidates) {
        Map<CollectorSource, WorkloadCollector> bySource = new EnumMap<>(CollectorSource.class);
        for (var candidate : candidates) {
            var existing = bySource.putIfAbsent(candidate.source(), candidate);
            if (existing != null) {
                LOG.warnf(
                        "Ignoring duplicate collector %s for source %s, keeping %s",
                        candidate.getClass().getName(),
                        candidate.source().tag(),
                        existing.getClass().getName());
            }
        }
        var ordered = new ArrayList<>(bySource.values());
        ordered.sort(Comparator.comparingInt(c -> c.source().priority()));
        return List.copyOf(ordered);
    }

    private static String describe(Throwable error) {
        var message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }
}
