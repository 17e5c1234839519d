package idlescope.core.service.collect;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import idlescope.core.config.CollectionConfig;
import idlescope.core.model.collect.ClusterCapabilities;
import idlescope.core.port.out.AssessmentMetrics;
import idlescope.core.port.out.ClusterCapabilityDetector;

/**
 * Per-cluster cache of detected telemetry capabilities.
 *
 * <p>Entries are refreshed in the background once older than the configured
 * TTL. Reads during a refresh return the previous value instead of waiting.
 * A failed first detection is not cached: the caller gets core-only
 * capabilities and the next read detects again.
 */
@ApplicationScoped
public class CapabilityCache {

    private static final Logger LOG = Logger.getLogger(CapabilityCache.class);

    private final ClusterCapabilityDetector detector;
    private final AssessmentMetrics metrics;
    private final AsyncLoadingCache<String, ClusterCapabilities> cache;

    @Inject
    public CapabilityCache(
            ClusterCapabilityDetector detector,
            CollectionConfig config,
            AssessmentMetrics metrics,
            MeterRegistry meterRegistry) {
        this(
                detector,
                metrics,
                config.capabilityTtl(),
                config.capabilityCacheMaxEntries(),
                Ticker.systemTicker(),
                ForkJoinPool.commonPool());
        CaffeineCacheMetrics.monitor(meterRegistry, cache.synchronous(), "idlescope.capability.cache");
        LOG.infov(
                "Initialized capability cache: ttl={0}, maxEntries={1}",
                config.capabilityTtl(),
                config.capabilityCacheMaxEntries());
    }

    /**
     * Constructor for tests, with a controllable clock and refresh executor.
     */
    public CapabilityCache(
            ClusterCapabilityDetector detector,
            AssessmentMetrics metrics,
            Duration ttl,
            long maxEntries,
            Ticker ticker,
            Executor executor) {
        this.detector = detector;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .refreshAfterWrite(ttl)
                .ticker(ticker)
                .executor(executor)
                .recordStats()
                .buildAsync((clusterId, ignored) -> load(clusterId));
    }

    /**
     * Capabilities for a cluster, possibly stale, never failing.
     */
    public Uni<ClusterCapabilities> get(String clusterId) {
        // copy so that a cancelled run cannot cancel the shared load
        return Uni.createFrom()
                .completionStage(() -> cache.get(clusterId).copy())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(
                            "Capability detection failed for cluster %s, using core-only capabilities: %s",
                            clusterId, error.getMessage());
                    metrics.recordCapabilityFallback(clusterId);
                    return ClusterCapabilities.coreOnly();
                });
    }

    /**
     * Cached capabilities without triggering detection.
     */
    public Optional<ClusterCapabilities> peek(String clusterId) {
        var future = cache.getIfPresent(clusterId);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.getNow(null));
    }

    public void invalidate(String clusterId) {
        cache.synchronous().invalidate(clusterId);
    }

    private CompletableFuture<ClusterCapabilities> load(String clusterId) {
        LOG.debugf("Detecting capabilities of cluster %s", clusterId);
        return detector.detect(clusterId)
                .invoke(capabilities -> LOG.debugf("Cluster %s capabilities: %s", clusterId, capabilities))
                .subscribeAsCompletionStage();
    }
}
