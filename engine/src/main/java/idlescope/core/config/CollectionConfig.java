package idlescope.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for metrics collection.
 *
 * <p>Configuration prefix: {@code idlescope.collection}
 *
 * <p>Every collector runs under its own timeout, so a slow source delays a run
 * by at most {@link #collectorTimeout()}. The capability cache TTL controls
 * how often the optional telemetry backends of a cluster are re-detected.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code IDLESCOPE_COLLECTION_COLLECTOR_TIMEOUT} - e.g., "PT10S"</li>
 *   <li>{@code IDLESCOPE_COLLECTION_CAPABILITY_TTL} - e.g., "PT5M"</li>
 * </ul>
 */
@ConfigMapping(prefix = "idlescope.collection")
public interface CollectionConfig {

    /**
     * Upper bound for a single collector call.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration collectorTimeout();

    /**
     * Upper bound for each billing collaborator call.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration billingTimeout();

    /**
     * How long detected cluster capabilities are served before revalidation.
     *
     * @return TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration capabilityTtl();

    /**
     * Maximum number of clusters kept in the capability cache.
     *
     * @return maximum entries (default: 100)
     */
    @WithDefault("100")
    long capabilityCacheMaxEntries();

    /**
     * Maximum log bytes fetched per pod.
     *
     * @return byte limit (default: 1 MiB)
     */
    @WithDefault("1048576")
    long maxLogBytes();

    /**
     * Maximum number of replicas whose logs are fetched for a deployment.
     *
     * @return pod limit (default: 5)
     */
    @WithDefault("5")
    int maxLogPods();

    /**
     * Longest accepted assessment window.
     *
     * @return maximum range (default: 31 days)
     */
    @WithDefault("P31D")
    Duration maxRange();
}
