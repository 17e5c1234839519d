package idlescope.core.service.activity;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

import idlescope.core.model.activity.RequestRecord;

/**
 * Excludes requests whose user agent contains a known monitoring token.
 */
public class MonitoringAgentRule implements ExclusionRule {

    private final List<String> tokens;

    public MonitoringAgentRule(Collection<String> tokens) {
        this.tokens = tokens.stream()
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public String name() {
        return "monitoring-agent";
    }

    @Override
    public boolean excludes(RequestRecord record) {
        return record.userAgent()
                .map(ua -> ua.toLowerCase(Locale.ROOT))
                .map(ua -> tokens.stream().anyMatch(ua::contains))
                .orElse(false);
    }
}
