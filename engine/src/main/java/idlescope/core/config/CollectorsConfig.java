package idlescope.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Endpoints and toggles of the optional collectors.
 *
 * <p>Configuration prefix: {@code idlescope.collectors}
 *
 * <pre>
 * idlescope.collectors.prometheus.url=http://prometheus.monitoring:9090
 * idlescope.collectors.node-agent.enabled=true
 * idlescope.collectors.cloud-telemetry.url=http://telemetry-bridge:8080
 * </pre>
 */
@ConfigMapping(prefix = "idlescope.collectors")
public interface CollectorsConfig {

    Prometheus prometheus();

    NodeAgent nodeAgent();

    CloudTelemetry cloudTelemetry();

    interface Prometheus {

        /**
         * Base URL of the Prometheus HTTP API. The query-engine collector is disabled without it.
         */
        Optional<String> url();
    }

    interface NodeAgent {

        /**
         * Query kubelet stats through the API server proxy.
         *
         * @return whether the node-agent collector is enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    interface CloudTelemetry {

        /**
         * Base URL of the cloud telemetry bridge. The cloud collector is disabled without it.
         */
        Optional<String> url();
    }
}
