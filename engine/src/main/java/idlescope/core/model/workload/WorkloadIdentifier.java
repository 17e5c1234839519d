package idlescope.core.model.workload;

import java.util.Objects;

/**
 * Identifies the measurement subject across every telemetry source.
 *
 * <p>For {@link WorkloadKind#CLUSTER} the namespace is empty and the name is the
 * cluster name. Format validation (DNS-1123 labels) happens at the request
 * boundary, see {@code AssessmentRequestValidator}.
 *
 * @param name      workload name
 * @param namespace namespace the workload lives in (empty for clusters)
 * @param kind      workload kind
 */
public record WorkloadIdentifier(String name, String namespace, WorkloadKind kind) {

    public WorkloadIdentifier {
        Objects.requireNonNull(kind, "kind cannot be null");
        name = name == null ? "" : name;
        namespace = namespace == null ? "" : namespace;
    }

    public static WorkloadIdentifier pod(String namespace, String name) {
        return new WorkloadIdentifier(name, namespace, WorkloadKind.POD);
    }

    public static WorkloadIdentifier deployment(String namespace, String name) {
        return new WorkloadIdentifier(name, namespace, WorkloadKind.DEPLOYMENT);
    }

    public static WorkloadIdentifier cluster(String name) {
        return new WorkloadIdentifier(name, "", WorkloadKind.CLUSTER);
    }

    @Override
    public String toString() {
        if (kind == WorkloadKind.CLUSTER) {
            return "cluster/" + name;
        }
        return kind.name().toLowerCase() + "/" + namespace + "/" + name;
    }
}
