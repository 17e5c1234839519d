package idlescope.core.service.activity;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

import idlescope.core.model.activity.RequestRecord;

/**
 * Excludes requests from in-cluster infrastructure clients, by user-agent signature.
 */
public class InternalClientRule implements ExclusionRule {

    private final List<Pattern> signatures;

    public InternalClientRule(Collection<String> signatures) {
        this.signatures = signatures.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Pattern::compile)
                .toList();
    }

    @Override
    public String name() {
        return "internal-client";
    }

    @Override
    public boolean excludes(RequestRecord record) {
        return record.userAgent()
                .map(ua -> signatures.stream().anyMatch(p -> p.matcher(ua).find()))
                .orElse(false);
    }
}
