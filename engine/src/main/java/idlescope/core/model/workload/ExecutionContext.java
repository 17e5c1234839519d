package idlescope.core.model.workload;

import java.util.Objects;

/**
 * Already-authorized caller context handed to the engine.
 *
 * <p>Permission checks happen upstream; the engine only uses the cluster id to
 * select capabilities and billing data, and the principal for logging.
 *
 * @param clusterId the cluster the workload runs in
 * @param principal the authorized caller
 */
public record ExecutionContext(String clusterId, String principal) {

    public ExecutionContext {
        Objects.requireNonNull(clusterId, "clusterId cannot be null");
        principal = principal == null ? "anonymous" : principal;
    }
}
