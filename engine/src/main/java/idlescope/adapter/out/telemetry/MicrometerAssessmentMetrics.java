package idlescope.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import idlescope.config.TelemetryConfigMapping;
import idlescope.core.model.assessment.AssessmentOutcome;
import idlescope.core.model.collect.CollectorResult;
import idlescope.core.port.out.AssessmentMetrics;

/**
 * Records engine metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code idlescope.collector.results} - Collector outcomes by source and outcome</li>
 *   <li>{@code idlescope.collector.latency} - Collector call latency by source</li>
 *   <li>{@code idlescope.assessment.outcomes} - Assessment outcomes</li>
 *   <li>{@code idlescope.assessment.duration} - Assessment run duration</li>
 *   <li>{@code idlescope.capability.fallbacks} - Runs that fell back to core-only capabilities</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAssessmentMetrics implements AssessmentMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAssessmentMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordCollectorResult(CollectorResult result, long latencyMs) {
        if (!enabled) {
            return;
        }

        var source = result.source().tag();
        Counter.builder("idlescope.collector.results")
                .description("Collector call outcomes")
                .tag("source", source)
                .tag("outcome", outcome(result))
                .register(registry)
                .increment();

        Timer.builder("idlescope.collector.latency")
                .description("Time for a collector to answer")
                .tag("source", source)
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordAssessment(AssessmentOutcome outcome, long durationMs) {
        if (!enabled) {
            return;
        }

        var type = outcomeType(outcome);
        Counter.builder("idlescope.assessment.outcomes")
                .description("Assessment outcomes")
                .tag("outcome", type)
                .register(registry)
                .increment();

        Timer.builder("idlescope.assessment.duration")
                .description("Assessment run duration")
                .tag("outcome", type)
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordCapabilityFallback(String clusterId) {
        if (!enabled) {
            return;
        }

        Counter.builder("idlescope.capability.fallbacks")
                .description("Runs using core-only capabilities after failed detection")
                .tag("cluster_id", clusterId == null ? "unknown" : clusterId)
                .register(registry)
                .increment();
    }

    private static String outcome(CollectorResult result) {
        if (result instanceof CollectorResult.Failure failure) {
            return failure.kind().name().toLowerCase(Locale.ROOT);
        }
        return "success";
    }

    private static String outcomeType(AssessmentOutcome outcome) {
        if (outcome instanceof AssessmentOutcome.Completed) {
            return "completed";
        }
        if (outcome instanceof AssessmentOutcome.Rejected) {
            return "rejected";
        }
        return "failed";
    }
}
