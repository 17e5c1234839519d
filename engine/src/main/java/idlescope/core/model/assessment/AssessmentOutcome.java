package idlescope.core.model.assessment;

/**
 * Terminal outcome of {@code assess}.
 */
public sealed interface AssessmentOutcome {

    /** The run reached {@link PipelineStage#DONE}; the result may still be degraded. */
    record Completed(AssessmentResult result) implements AssessmentOutcome {}

    /** The request was invalid and no stage ran. */
    record Rejected(String reason) implements AssessmentOutcome {}

    /** A stage failed unexpectedly. */
    record Failed(PipelineStage stage, String message) implements AssessmentOutcome {}

    default boolean isCompleted() {
        return this instanceof Completed;
    }
}
