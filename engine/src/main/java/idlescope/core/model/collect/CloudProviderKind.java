package idlescope.core.model.collect;

import java.util.Locale;

/**
 * Cloud provider hosting the cluster, as far as it can be detected.
 */
public enum CloudProviderKind {
    NONE,
    AWS,
    GCP,
    AZURE;

    public boolean isCloud() {
        return this != NONE;
    }

    /**
     * Derive the provider from a node {@code spec.providerID} such as
     * {@code aws:///us-east-1a/i-0abc} or {@code gce://project/zone/name}.
     */
    public static CloudProviderKind fromProviderId(String providerId) {
        if (providerId == null) {
            return NONE;
        }
        var lower = providerId.toLowerCase(Locale.ROOT);
        if (lower.startsWith("aws://")) {
            return AWS;
        }
        if (lower.startsWith("gce://")) {
            return GCP;
        }
        if (lower.startsWith("azure://")) {
            return AZURE;
        }
        return NONE;
    }

    /**
     * Fallback detection from managed-cluster node naming conventions.
     */
    public static CloudProviderKind fromNodeName(String nodeName) {
        if (nodeName == null) {
            return NONE;
        }
        var lower = nodeName.toLowerCase(Locale.ROOT);
        if (lower.contains("eks") || lower.startsWith("ip-")) {
            return AWS;
        }
        if (lower.contains("gke")) {
            return GCP;
        }
        if (lower.contains("aks")) {
            return AZURE;
        }
        return NONE;
    }
}
