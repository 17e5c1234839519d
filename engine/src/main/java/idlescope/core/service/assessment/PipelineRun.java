package idlescope.core.service.assessment;

import java.util.ArrayList;
import java.util.List;

import idlescope.core.model.assessment.PipelineStage;
import idlescope.core.model.workload.WorkloadIdentifier;

/**
 * Stage bookkeeping for one assessment run.
 *
 * <p>Not thread-safe; a run is driven by a single pipeline.
 */
public class PipelineRun {

    private final WorkloadIdentifier workload;
    private final long startedNanos;
    private final List<PipelineStage> history = new ArrayList<>();
    private PipelineStage current = PipelineStage.IDLE;

    public PipelineRun(WorkloadIdentifier workload) {
        this.workload = workload;
        this.startedNanos = System.nanoTime();
        history.add(current);
    }

    public PipelineStage current() {
        return current;
    }

    /**
     * Move to the next stage.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void advance(PipelineStage next) {
        if (!current.canMoveTo(next)) {
            throw new IllegalStateException(
                    "Illegal stage transition for " + workload + ": " + current + " -> " + next);
        }
        current = next;
        history.add(next);
    }

    /**
     * Mark the run failed; a no-op once the run is terminal.
     *
     * @return the stage the run was in when it failed
     */
    public PipelineStage fail() {
        var failedIn = current;
        if (!current.isTerminal()) {
            advance(PipelineStage.FAILED);
        }
        return failedIn;
    }

    public List<PipelineStage> history() {
        return List.copyOf(history);
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
