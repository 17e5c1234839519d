package idlescope.core.model.assessment;

import java.time.Instant;
import java.util.List;

import idlescope.core.model.activity.BusinessActivity;
import idlescope.core.model.collect.WorkloadMetrics;
import idlescope.core.model.cost.CostResult;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * The composed assessment handed to presentation collaborators.
 *
 * @param workload       assessed workload
 * @param range          assessed window
 * @param metrics        merged metrics (possibly the no-data record)
 * @param activity       classified request activity
 * @param cost           attributed cost or the reason it is unavailable
 * @param idle           idle analysis
 * @param recommendation suggested action and saving
 * @param confidence     overall confidence in [0, 1]
 * @param stages         stages the run passed through, in order
 * @param completedAt    completion time
 */
public record AssessmentResult(
        WorkloadIdentifier workload,
        TimeRange range,
        WorkloadMetrics metrics,
        BusinessActivity activity,
        CostResult cost,
        IdleAnalysis idle,
        Recommendation recommendation,
        double confidence,
        List<PipelineStage> stages,
        Instant completedAt) {

    public AssessmentResult {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }
}
