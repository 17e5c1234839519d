package idlescope.core.model.assessment;

public enum RecommendedAction {
    SCALE_TO_ZERO,
    RIGHTSIZE,
    NO_ACTION,
    INSUFFICIENT_DATA
}
