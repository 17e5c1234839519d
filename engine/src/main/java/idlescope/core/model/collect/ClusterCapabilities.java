package idlescope.core.model.collect;

import java.time.Instant;
import java.util.Objects;

/**
 * Optional telemetry capabilities detected for a cluster.
 *
 * @param hasMetricsAggregator whether the resource metrics API is served
 * @param hasQueryEngine       whether a time-series query engine is reachable
 * @param cloudProvider        detected cloud provider
 * @param detectedAt           when detection ran
 */
public record ClusterCapabilities(
        boolean hasMetricsAggregator, boolean hasQueryEngine, CloudProviderKind cloudProvider, Instant detectedAt) {

    public ClusterCapabilities {
        cloudProvider = cloudProvider == null ? CloudProviderKind.NONE : cloudProvider;
        Objects.requireNonNull(detectedAt, "detectedAt cannot be null");
    }

    /**
     * Capabilities of a cluster where nothing beyond the core API is known.
     */
    public static ClusterCapabilities coreOnly() {
        return new ClusterCapabilities(false, false, CloudProviderKind.NONE, Instant.now());
    }
}
