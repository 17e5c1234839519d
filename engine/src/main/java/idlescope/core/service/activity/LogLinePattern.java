package idlescope.core.service.activity;

import java.util.Optional;

/**
 * A known access-log line format.
 */
public interface LogLinePattern {

    String name();

    /**
     * Parse a line, with any leading log-API timestamp already removed.
     *
     * @return the parsed line, or empty when the line is not in this format
     */
    Optional<ParsedLogLine> parse(String line);
}
