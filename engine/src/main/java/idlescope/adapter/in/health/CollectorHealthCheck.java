package idlescope.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import idlescope.core.config.KubernetesConfig;
import idlescope.core.service.collect.CapabilityCache;
import idlescope.core.service.collect.CollectorRegistry;

/**
 * Readiness check listing the registered collectors.
 *
 * <p>Reports each collector as enabled or disabled and, once detected, the
 * cached capabilities of the connected cluster. Always UP: the core API
 * collector is required at startup and optional backends only degrade
 * results.
 */
@Readiness
@ApplicationScoped
public class CollectorHealthCheck implements HealthCheck {

    private final CollectorRegistry registry;
    private final CapabilityCache capabilityCache;
    private final String clusterId;

    @Inject
    public CollectorHealthCheck(CollectorRegistry registry, CapabilityCache capabilityCache, KubernetesConfig config) {
        this.registry = registry;
        this.capabilityCache = capabilityCache;
        this.clusterId = config.clusterId();
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("collectors");
        for (var collector : registry.registeredCollectors()) {
            builder.withData("collector." + collector.source().tag(), collector.isEnabled() ? "enabled" : "disabled");
        }
        builder.withData("cluster", clusterId);
        capabilityCache.peek(clusterId).ifPresentOrElse(
                capabilities -> {
                    builder.withData("capabilities.metrics-aggregator", capabilities.hasMetricsAggregator());
                    builder.withData("capabilities.query-engine", capabilities.hasQueryEngine());
                    builder.withData("capabilities.cloud-provider", capabilities.cloudProvider().name());
                    builder.withData("capabilities.detected-at", capabilities.detectedAt().toString());
                },
                () -> builder.withData("capabilities", "not detected"));

        return builder.up().build();
    }
}
