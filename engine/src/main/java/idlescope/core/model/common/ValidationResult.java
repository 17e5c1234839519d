package idlescope.core.model.common;

public sealed interface ValidationResult {

    record Valid() implements ValidationResult {}

    record Invalid(String reason) implements ValidationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }

    default boolean isInvalid() {
        return this instanceof Invalid;
    }

    static ValidationResult valid() {
        return new Valid();
    }

    static ValidationResult invalid(String reason) {
        return new Invalid(reason);
    }
}
