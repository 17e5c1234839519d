package idlescope.core.service.activity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import idlescope.core.model.activity.RequestRecord;
import idlescope.core.model.workload.TimeRange;

/**
 * Turns a raw log payload into request records within a window.
 *
 * <p>Each line is timestamped by the leading token the Kubernetes log API
 * adds, falling back to the timestamp inside the recognized format. Lines
 * without a timestamp, outside the window, or in no known format are
 * dropped. A malformed line never fails extraction.
 */
@ApplicationScoped
public class RequestLogExtractor {

    private static final Logger LOG = Logger.getLogger(RequestLogExtractor.class);

    private final List<LogLinePattern> patterns;

    @Inject
    public RequestLogExtractor(ObjectMapper objectMapper) {
        this(List.of(new CommonLogPattern(), new KeyValueLogPattern(), new JsonLogPattern(objectMapper)));
    }

    public RequestLogExtractor(List<LogLinePattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public List<RequestRecord> extract(String payload, TimeRange range) {
        if (payload == null || payload.isBlank()) {
            return List.of();
        }
        var records = new ArrayList<RequestRecord>();
        var lines = 0;
        var unrecognized = 0;
        var untimed = 0;
        var outside = 0;
        for (var rawLine : payload.split("\\R")) {
            var line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            lines++;
            var leading = LogTimestamps.leading(line);
            var body = leading.map(LogTimestamps.Leading::remainder).orElse(line);
            var parsed = match(body);
            if (parsed.isEmpty()) {
                unrecognized++;
                LOG.tracef("Unrecognized log line: %s", line);
                continue;
            }
            var fields = parsed.get();
            var timestamp = leading.map(LogTimestamps.Leading::timestamp).or(fields::timestamp);
            if (timestamp.isEmpty()) {
                untimed++;
                continue;
            }
            if (!range.contains(timestamp.get())) {
                outside++;
                continue;
            }
            records.add(new RequestRecord(
                    timestamp.get(),
                    fields.method(),
                    fields.path(),
                    fields.statusCode(),
                    fields.userAgent(),
                    fields.sourceIp()));
        }
        LOG.debugf(
                "Extracted %d requests from %d lines (%d unrecognized, %d without timestamp, %d outside range)",
                records.size(), lines, unrecognized, untimed, outside);
        return List.copyOf(records);
    }

    private Optional<ParsedLogLine> match(String line) {
        for (var pattern : patterns) {
            var parsed = pattern.parse(line);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }
}
