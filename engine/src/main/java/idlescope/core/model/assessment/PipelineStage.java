package idlescope.core.model.assessment;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of one assessment run.
 *
 * <p>Stages advance strictly in declaration order; any non-terminal stage may
 * move to {@link #FAILED}.
 */
public enum PipelineStage {
    IDLE,
    COLLECTING,
    MERGING,
    CLASSIFYING,
    ATTRIBUTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public Set<PipelineStage> allowedNext() {
        return switch (this) {
            case IDLE -> EnumSet.of(COLLECTING, FAILED);
            case COLLECTING -> EnumSet.of(MERGING, FAILED);
            case MERGING -> EnumSet.of(CLASSIFYING, FAILED);
            case CLASSIFYING -> EnumSet.of(ATTRIBUTING, FAILED);
            case ATTRIBUTING -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(PipelineStage.class);
        };
    }

    public boolean canMoveTo(PipelineStage next) {
        return allowedNext().contains(next);
    }
}
