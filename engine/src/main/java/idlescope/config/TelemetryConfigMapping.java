package idlescope.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for engine telemetry.
 *
 * <p>Metrics are disabled by default and must be enabled explicitly:
 * <pre>{@code
 * idlescope.telemetry.enabled=true
 * idlescope.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "idlescope.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle; when disabled every sub-feature is disabled too.
     */
    @WithDefault("false")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         * Requires idlescope.telemetry.enabled=true to take effect.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
