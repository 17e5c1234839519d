package idlescope.core.model.collect;

import java.util.Objects;

/**
 * Output of one collector invocation.
 *
 * <p>A failure is always reported as {@link Failure}, never as an empty
 * {@link Success}. Results are owned by a single pipeline run and discarded
 * after the merge.
 */
public sealed interface CollectorResult {

    CollectorSource source();

    record Success(CollectorSource source, MetricsSnapshot snapshot) implements CollectorResult {
        public Success {
            Objects.requireNonNull(source, "source cannot be null");
            Objects.requireNonNull(snapshot, "snapshot cannot be null");
        }
    }

    record Failure(CollectorSource source, CollectorFailureKind kind, String message) implements CollectorResult {
        public Failure {
            Objects.requireNonNull(source, "source cannot be null");
            Objects.requireNonNull(kind, "kind cannot be null");
            message = message == null ? "" : message;
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    static CollectorResult success(CollectorSource source, MetricsSnapshot snapshot) {
        return new Success(source, snapshot);
    }

    static CollectorResult unavailable(CollectorSource source, String message) {
        return new Failure(source, CollectorFailureKind.UNAVAILABLE, message);
    }

    static CollectorResult timeout(CollectorSource source, String message) {
        return new Failure(source, CollectorFailureKind.TIMEOUT, message);
    }

    static CollectorResult unsupported(CollectorSource source, String message) {
        return new Failure(source, CollectorFailureKind.UNSUPPORTED, message);
    }

    static CollectorResult error(CollectorSource source, String message) {
        return new Failure(source, CollectorFailureKind.ERROR, message);
    }
}
