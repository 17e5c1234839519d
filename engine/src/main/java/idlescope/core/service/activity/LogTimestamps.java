package idlescope.core.service.activity;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Timestamp formats found in container logs.
 */
final class LogTimestamps {

    private static final DateTimeFormatter COMMON_LOG =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss[ Z]", Locale.ENGLISH);
    private static final BigDecimal MAX_EPOCH_SECONDS = BigDecimal.valueOf(Instant.MAX.getEpochSecond());

    private LogTimestamps() {
        // Utility class
    }

    /**
     * A line split into its leading RFC 3339 timestamp and the remainder.
     */
    record Leading(Instant timestamp, String remainder) {}

    /**
     * Split off the timestamp the Kubernetes log API prepends with {@code timestamps=true}.
     */
    static Optional<Leading> leading(String line) {
        if (line.isEmpty() || !Character.isDigit(line.charAt(0))) {
            return Optional.empty();
        }
        var space = line.indexOf(' ');
        var token = space < 0 ? line : line.substring(0, space);
        if (token.indexOf('T') < 0) {
            return Optional.empty();
        }
        return iso(token).map(ts -> new Leading(ts, space < 0 ? "" : line.substring(space + 1)));
    }

    /**
     * ISO-8601 instant, offset date-time, or local date-time taken as UTC.
     */
    static Optional<Instant> iso(String value) {
        return attempt(() -> Instant.parse(value))
                .or(() -> attempt(() -> OffsetDateTime.parse(value).toInstant()))
                .or(() -> attempt(() -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC)));
    }

    /**
     * Common log format timestamp such as {@code 01/Jan/2024:00:00:00 +0000}; no zone means UTC.
     */
    static Optional<Instant> commonLog(String value) {
        try {
            var parsed = COMMON_LOG.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Epoch seconds or milliseconds, told apart by magnitude.
     */
    static Optional<Instant> epoch(BigDecimal value) {
        if (value.signum() < 0) {
            return Optional.empty();
        }
        var seconds = value.compareTo(BigDecimal.valueOf(100_000_000_000L)) > 0
                ? value.movePointLeft(3)
                : value;
        if (seconds.compareTo(MAX_EPOCH_SECONDS) > 0) {
            return Optional.empty();
        }
        try {
            var whole = seconds.longValue();
            var nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Optional.of(Instant.ofEpochSecond(whole, nanos));
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Any of the textual forms, including numeric epoch strings.
     */
    static Optional<Instant> flexible(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var trimmed = value.trim();
        var parsed = iso(trimmed).or(() -> commonLog(trimmed));
        if (parsed.isPresent()) {
            return parsed;
        }
        try {
            return epoch(new BigDecimal(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
