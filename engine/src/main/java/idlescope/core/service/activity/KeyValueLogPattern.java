package idlescope.core.service.activity;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Structured {@code key=value} access log lines (logfmt).
 *
 * <pre>
 * ts=2024-01-01T00:00:00Z method=GET path=/api/orders status=200 user_agent="curl/8.4.0" client_ip=10.0.0.1
 * </pre>
 *
 * <p>A line is recognized when it carries a method, a path and a numeric status.
 */
public class KeyValueLogPattern implements LogLinePattern {

    private static final Pattern PAIR = Pattern.compile("([A-Za-z_][\\w.-]*)=(?:\"((?:[^\"\\\\]|\\\\.)*)\"|(\\S*))");

    static final List<String> METHOD_KEYS = List.of("method", "http_method", "verb", "request_method");
    static final List<String> PATH_KEYS = List.of("path", "uri", "url", "request_uri", "http_path", "request_path");
    static final List<String> STATUS_KEYS = List.of("status", "status_code", "http_status", "response_status", "code");
    static final List<String> USER_AGENT_KEYS =
            List.of("user_agent", "useragent", "ua", "http_user_agent", "userAgent");
    static final List<String> SOURCE_IP_KEYS =
            List.of("client_ip", "remote_addr", "remote_ip", "source_ip", "src_ip", "ip", "clientIp");
    static final List<String> TIMESTAMP_KEYS = List.of("ts", "time", "timestamp", "@timestamp", "datetime");

    @Override
    public String name() {
        return "key-value";
    }

    @Override
    public Optional<ParsedLogLine> parse(String line) {
        var fields = new HashMap<String, String>();
        var matcher = PAIR.matcher(line);
        while (matcher.find()) {
            var value = matcher.group(2) != null ? matcher.group(2).replace("\\\"", "\"") : matcher.group(3);
            fields.putIfAbsent(matcher.group(1), value);
        }
        if (fields.isEmpty()) {
            return Optional.empty();
        }

        var method = first(fields, METHOD_KEYS);
        var path = first(fields, PATH_KEYS);
        var status = first(fields, STATUS_KEYS).flatMap(KeyValueLogPattern::statusCode);
        if (method.isEmpty() || path.isEmpty() || status.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedLogLine(
                first(fields, TIMESTAMP_KEYS).flatMap(LogTimestamps::flexible),
                method.get().toUpperCase(Locale.ROOT),
                path.get(),
                status.get(),
                first(fields, USER_AGENT_KEYS),
                first(fields, SOURCE_IP_KEYS)));
    }

    static Optional<Integer> statusCode(String value) {
        if (value.length() != 3 || !value.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(value));
    }

    private static Optional<String> first(Map<String, String> fields, List<String> keys) {
        return keys.stream()
                .map(fields::get)
                .filter(value -> value != null && !value.isBlank())
                .findFirst();
    }
}
