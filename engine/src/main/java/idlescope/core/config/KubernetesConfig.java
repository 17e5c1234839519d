package idlescope.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Connection settings for the Kubernetes API server.
 *
 * <p>Configuration prefix: {@code idlescope.kubernetes}
 */
@ConfigMapping(prefix = "idlescope.kubernetes")
public interface KubernetesConfig {

    /**
     * Base URL of the API server.
     *
     * @return API server URL (default: https://kubernetes.default.svc)
     */
    @WithDefault("https://kubernetes.default.svc")
    String apiUrl();

    /**
     * Bearer token sent with every API request, typically the mounted service account token.
     */
    Optional<String> bearerToken();

    /**
     * Accept any TLS certificate from the API server. Only meant for local clusters.
     *
     * @return whether certificate checks are skipped (default: false)
     */
    @WithDefault("false")
    boolean trustAll();

    /**
     * Identifier of the cluster this engine instance is connected to.
     *
     * @return cluster id (default: "default")
     */
    @WithDefault("default")
    String clusterId();
}
