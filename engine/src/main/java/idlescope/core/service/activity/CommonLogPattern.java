package idlescope.core.service.activity;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Positional HTTP access log, in common or combined log format.
 *
 * <pre>
 * 10.0.0.1 - - [01/Jan/2024:00:00:00 +0000] "GET /api/orders HTTP/1.1" 200 512 "-" "curl/8.4.0"
 * </pre>
 */
public class CommonLogPattern implements LogLinePattern {

    private static final Pattern LINE = Pattern.compile(
            "^(\\S+) \\S+ \\S+ \\[([^\\]]+)] \"([A-Z]{3,7}) (\\S+)(?: [^\"]*)?\" (\\d{3}) (?:\\d+|-)"
                    + "(?: \"([^\"]*)\" \"([^\"]*)\")?.*$");

    @Override
    public String name() {
        return "common-log";
    }

    @Override
    public Optional<ParsedLogLine> parse(String line) {
        var matcher = LINE.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedLogLine(
                LogTimestamps.commonLog(matcher.group(2)),
                matcher.group(3),
                matcher.group(4),
                Integer.parseInt(matcher.group(5)),
                Optional.ofNullable(matcher.group(7)),
                Optional.of(matcher.group(1))));
    }
}
