package idlescope.adapter.out.collector;

import idlescope.core.model.collect.CollectorFailureKind;

/**
 * Raised inside a collector when its backend cannot answer; converted to a
 * {@link idlescope.core.model.collect.CollectorResult.Failure} at the collector boundary.
 */
public class CollectorException extends RuntimeException {

    private final CollectorFailureKind kind;

    public CollectorException(CollectorFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollectorException(CollectorFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CollectorFailureKind kind() {
        return kind;
    }

    public static CollectorException unavailable(String message) {
        return new CollectorException(CollectorFailureKind.UNAVAILABLE, message);
    }

    public static CollectorException unsupported(String message) {
        return new CollectorException(CollectorFailureKind.UNSUPPORTED, message);
    }
}
