package idlescope.core.port.out;

import idlescope.core.model.assessment.AssessmentOutcome;
import idlescope.core.model.collect.CollectorResult;

/**
 * Port interface for recording engine metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AssessmentMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the result of one collector call.
     *
     * @param result    the collector result
     * @param latencyMs call latency in milliseconds
     */
    void recordCollectorResult(CollectorResult result, long latencyMs);

    /**
     * Record the outcome of an assessment run.
     *
     * @param outcome    the outcome
     * @param durationMs run duration in milliseconds
     */
    void recordAssessment(AssessmentOutcome outcome, long durationMs);

    /**
     * Record that capability detection failed and core-only capabilities were used.
     *
     * @param clusterId the cluster
     */
    void recordCapabilityFallback(String clusterId);
}
