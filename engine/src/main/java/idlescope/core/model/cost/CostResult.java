package idlescope.core.model.cost;

import java.util.Optional;

/**
 * Outcome of cost attribution.
 *
 * <p>{@link Unavailable} is reported instead of a zero cost whenever the
 * cost cannot be determined.
 */
public sealed interface CostResult {

    record Attributed(CostBreakdown breakdown) implements CostResult {}

    record Unavailable(CostUnavailableReason reason, String message) implements CostResult {}

    default boolean isAvailable() {
        return this instanceof Attributed;
    }

    default Optional<CostBreakdown> attributedBreakdown() {
        if (this instanceof Attributed attributed) {
            return Optional.of(attributed.breakdown());
        }
        return Optional.empty();
    }

    static CostResult attributed(CostBreakdown breakdown) {
        return new Attributed(breakdown);
    }

    static CostResult unavailable(CostUnavailableReason reason, String message) {
        return new Unavailable(reason, message);
    }
}
