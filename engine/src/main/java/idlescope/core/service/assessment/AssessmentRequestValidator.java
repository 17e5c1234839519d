package idlescope.core.service.assessment;

import java.time.Duration;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import idlescope.core.config.CollectionConfig;
import idlescope.core.model.common.ValidationResult;
import idlescope.core.model.workload.ExecutionContext;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.model.workload.WorkloadKind;

/**
 * Validates assessment requests before any stage runs.
 *
 * <p>Workload names must be DNS-1123 subdomains and namespaces DNS-1123
 * labels. The window must be ordered and no longer than the configured
 * maximum.
 */
@ApplicationScoped
public class AssessmentRequestValidator {

    private static final Pattern DNS_LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");
    private static final Pattern DNS_SUBDOMAIN = Pattern.compile("^[a-z0-9]([-a-z0-9.]*[a-z0-9])?$");
    private static final int MAX_LABEL_LENGTH = 63;
    private static final int MAX_SUBDOMAIN_LENGTH = 253;

    private final Duration maxRange;

    @Inject
    public AssessmentRequestValidator(CollectionConfig config) {
        this(config.maxRange());
    }

    public AssessmentRequestValidator(Duration maxRange) {
        this.maxRange = maxRange;
    }

    public ValidationResult validate(WorkloadIdentifier workload, TimeRange range, ExecutionContext context) {
        if (workload == null) {
            return ValidationResult.invalid("Workload is required");
        }
        if (range == null) {
            return ValidationResult.invalid("Time range is required");
        }
        if (context == null || context.clusterId().isBlank()) {
            return ValidationResult.invalid("Cluster id is required");
        }
        if (!range.isOrdered()) {
            return ValidationResult.invalid(
                    "Time range end must be after start: [" + range.start() + ", " + range.end() + ")");
        }
        if (range.duration().compareTo(maxRange) > 0) {
            return ValidationResult.invalid(
                    "Time range of " + range.duration() + " exceeds the maximum of " + maxRange);
        }
        if (workload.name().isBlank()) {
            return ValidationResult.invalid("Workload name is required");
        }
        if (workload.kind() == WorkloadKind.CLUSTER) {
            return ValidationResult.valid();
        }
        if (workload.name().length() > MAX_SUBDOMAIN_LENGTH
                || !DNS_SUBDOMAIN.matcher(workload.name()).matches()) {
            return ValidationResult.invalid("Invalid workload name: " + workload.name());
        }
        if (workload.namespace().length() > MAX_LABEL_LENGTH
                || !DNS_LABEL.matcher(workload.namespace()).matches()) {
            return ValidationResult.invalid("Invalid namespace: '" + workload.namespace() + "'");
        }
        return ValidationResult.valid();
    }
}
