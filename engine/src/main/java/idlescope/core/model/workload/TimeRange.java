package idlescope.core.model.workload;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open query window {@code [start, end)}.
 *
 * <p>{@code end > start} is checked by {@link #isOrdered()} at the request
 * boundary; every downstream query is clipped to this range.
 *
 * @param start inclusive start
 * @param end   exclusive end
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
    }

    /**
     * Range of the given length ending at {@code end}.
     */
    public static TimeRange lastOf(Duration length, Instant end) {
        return new TimeRange(end.minus(length), end);
    }

    public boolean isOrdered() {
        return end.isAfter(start);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * Length of the range in fractional hours.
     */
    public double hours() {
        return duration().toMillis() / 3_600_000.0;
    }
}
