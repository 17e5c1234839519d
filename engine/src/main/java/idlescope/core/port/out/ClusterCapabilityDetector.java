package idlescope.core.port.out;

import io.smallrye.mutiny.Uni;

import idlescope.core.model.collect.ClusterCapabilities;

/**
 * Port for detecting the optional telemetry backends of a cluster.
 */
public interface ClusterCapabilityDetector {

    /**
     * Detect capabilities of a cluster. May fail; callers fall back to core-only capabilities.
     *
     * @param clusterId the cluster to inspect
     * @return detected capabilities
     */
    Uni<ClusterCapabilities> detect(String clusterId);
}
