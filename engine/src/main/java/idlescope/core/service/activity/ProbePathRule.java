package idlescope.core.service.activity;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import idlescope.core.model.activity.RequestRecord;

/**
 * Excludes requests to well-known health and metrics endpoints.
 *
 * <p>Paths are compared without query string and case-insensitively.
 */
public class ProbePathRule implements ExclusionRule {

    private final Set<String> paths;

    public ProbePathRule(Collection<String> paths) {
        this.paths = paths.stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(p -> p.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String name() {
        return "probe-path";
    }

    @Override
    public boolean excludes(RequestRecord record) {
        return paths.contains(record.pathWithoutQuery().toLowerCase(Locale.ROOT));
    }
}
