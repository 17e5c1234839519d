package idlescope.core.service.activity;

import java.time.Instant;
import java.util.Optional;

/**
 * Request fields recognized in a log line, before range filtering.
 *
 * @param timestamp  timestamp embedded in the line, if any
 * @param method     HTTP method, upper-cased
 * @param path       request path including query string
 * @param statusCode response status
 * @param userAgent  user agent, if logged
 * @param sourceIp   client address, if logged
 */
public record ParsedLogLine(
        Optional<Instant> timestamp,
        String method,
        String path,
        int statusCode,
        Optional<String> userAgent,
        Optional<String> sourceIp) {}
