package idlescope.core.model.assessment;

/**
 * Idle verdict, recommendation and confidence derived from one run's data.
 */
public record WorkloadEvaluation(IdleAnalysis idle, Recommendation recommendation, double confidence) {}
