package idlescope.core.service.activity;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import idlescope.core.config.ClassificationConfig;
import idlescope.core.model.activity.BusinessActivity;
import idlescope.core.model.activity.RequestRecord;

/**
 * Separates business requests from probes, monitoring and internal traffic.
 *
 * <p>Rules are evaluated in order and the first one that matches excludes the
 * request. A request no rule excludes is business traffic.
 */
@ApplicationScoped
public class BusinessActivityClassifier {

    private static final Logger LOG = Logger.getLogger(BusinessActivityClassifier.class);

    private final List<ExclusionRule> rules;

    @Inject
    public BusinessActivityClassifier(ClassificationConfig config) {
        this(List.of(
                new ProbePathRule(config.probePaths()),
                new MonitoringAgentRule(config.monitoringAgents()),
                new InternalClientRule(config.internalClients())));
    }

    public BusinessActivityClassifier(List<ExclusionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The first rule excluding the request, if any.
     */
    public Optional<ExclusionRule> exclusionFor(RequestRecord record) {
        for (var rule : rules) {
            if (rule.excludes(record)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean isBusiness(RequestRecord record) {
        return exclusionFor(record).isEmpty();
    }

    public BusinessActivity classify(List<RequestRecord> records) {
        var accumulator = new BusinessActivity.Accumulator();
        for (var record : records) {
            var exclusion = exclusionFor(record);
            if (exclusion.isPresent()) {
                accumulator.excluded(record, exclusion.get().name());
            } else {
                accumulator.business(record);
            }
        }
        var activity = accumulator.build();
        LOG.debugf(
                "Classified %d requests: %d business, exclusions %s",
                activity.totalRequests(), activity.businessRequests(), activity.exclusionsByRule());
        return activity;
    }
}
