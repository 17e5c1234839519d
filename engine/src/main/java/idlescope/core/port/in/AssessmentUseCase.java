package idlescope.core.port.in;

import io.smallrye.mutiny.Uni;

import idlescope.core.model.assessment.AssessmentOutcome;
import idlescope.core.model.workload.ExecutionContext;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Use case for assessing the cost and activity of a workload.
 */
public interface AssessmentUseCase {

    /**
     * Assess a workload over a time window.
     *
     * <p>The returned {@link Uni} never fails for collector or billing errors;
     * those degrade the result instead. Cancelling the subscription cancels every
     * pending collector call.
     *
     * @param workload the workload to assess
     * @param range    the window to assess
     * @param context  already-authorized execution context
     * @return the outcome of the run
     */
    Uni<AssessmentOutcome> assess(WorkloadIdentifier workload, TimeRange range, ExecutionContext context);
}
