package idlescope.core.model.assessment;

import java.util.Objects;
import java.util.Optional;

/**
 * Suggested optimization and its projected saving.
 *
 * @param action                  the suggested action
 * @param estimatedMonthlySavings projected monthly saving, absent when cost is unknown
 * @param rationale               short explanation
 */
public record Recommendation(RecommendedAction action, Optional<Double> estimatedMonthlySavings, String rationale) {

    public Recommendation {
        Objects.requireNonNull(action, "action cannot be null");
        estimatedMonthlySavings = estimatedMonthlySavings == null ? Optional.empty() : estimatedMonthlySavings;
        rationale = rationale == null ? "" : rationale;
    }
}
