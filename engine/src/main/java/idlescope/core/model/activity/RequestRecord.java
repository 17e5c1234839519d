package idlescope.core.model.activity;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One inbound request recovered from a log line.
 *
 * @param timestamp  when the request was logged
 * @param method     HTTP method, upper-cased
 * @param path       request path including any query string
 * @param statusCode response status
 * @param userAgent  user agent, when the log format carries one
 * @param sourceIp   client address, when the log format carries one
 */
public record RequestRecord(
        Instant timestamp,
        String method,
        String path,
        int statusCode,
        Optional<String> userAgent,
        Optional<String> sourceIp) {

    public RequestRecord {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        userAgent = userAgent == null ? Optional.empty() : userAgent.filter(ua -> !ua.isBlank() && !"-".equals(ua));
        sourceIp = sourceIp == null ? Optional.empty() : sourceIp.filter(ip -> !ip.isBlank() && !"-".equals(ip));
    }

    /**
     * Path without its query string.
     */
    public String pathWithoutQuery() {
        var queryStart = path.indexOf('?');
        return queryStart < 0 ? path : path.substring(0, queryStart);
    }

    public RequestKey key() {
        return new RequestKey(method, pathWithoutQuery());
    }
}
