package idlescope.core.model.collect;

import java.util.List;
import java.util.Optional;

/**
 * Partial metrics reported by a single source.
 *
 * <p>Every field is optional: a source fills only what its backend knows. The
 * merger combines snapshots field by field.
 */
public record MetricsSnapshot(
        Optional<Double> cpuRequestCores,
        Optional<Double> cpuLimitCores,
        Optional<Long> memoryRequestBytes,
        Optional<Long> memoryLimitBytes,
        Optional<Double> cpuUsageCores,
        Optional<Long> memoryUsageBytes,
        Optional<String> nodeName,
        Optional<List<PodPlacement>> placements,
        Optional<List<ContainerUsage>> containerUsage,
        Optional<String> logs) {

    public MetricsSnapshot {
        cpuRequestCores = cpuRequestCores == null ? Optional.empty() : cpuRequestCores;
        cpuLimitCores = cpuLimitCores == null ? Optional.empty() : cpuLimitCores;
        memoryRequestBytes = memoryRequestBytes == null ? Optional.empty() : memoryRequestBytes;
        memoryLimitBytes = memoryLimitBytes == null ? Optional.empty() : memoryLimitBytes;
        cpuUsageCores = cpuUsageCores == null ? Optional.empty() : cpuUsageCores;
        memoryUsageBytes = memoryUsageBytes == null ? Optional.empty() : memoryUsageBytes;
        nodeName = nodeName == null ? Optional.empty() : nodeName.filter(n -> !n.isBlank());
        placements = placements == null ? Optional.empty() : placements.map(List::copyOf);
        containerUsage = containerUsage == null ? Optional.empty() : containerUsage.map(List::copyOf);
        logs = logs == null ? Optional.empty() : logs;
    }

    public static MetricsSnapshot empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return cpuRequestCores.isEmpty()
                && cpuLimitCores.isEmpty()
                && memoryRequestBytes.isEmpty()
                && memoryLimitBytes.isEmpty()
                && cpuUsageCores.isEmpty()
                && memoryUsageBytes.isEmpty()
                && nodeName.isEmpty()
                && placements.isEmpty()
                && containerUsage.isEmpty()
                && logs.isEmpty();
    }

    public static final class Builder {
        private Double cpuRequestCores;
        private Double cpuLimitCores;
        private Long memoryRequestBytes;
        private Long memoryLimitBytes;
        private Double cpuUsageCores;
        private Long memoryUsageBytes;
        private String nodeName;
        private List<PodPlacement> placements;
        private List<ContainerUsage> containerUsage;
        private String logs;

        private Builder() {}

        public Builder cpuRequestCores(Double cpuRequestCores) {
            this.cpuRequestCores = cpuRequestCores;
            return this;
        }

        public Builder cpuLimitCores(Double cpuLimitCores) {
            this.cpuLimitCores = cpuLimitCores;
            return this;
        }

        public Builder memoryRequestBytes(Long memoryRequestBytes) {
            this.memoryRequestBytes = memoryRequestBytes;
            return this;
        }

        public Builder memoryLimitBytes(Long memoryLimitBytes) {
            this.memoryLimitBytes = memoryLimitBytes;
            return this;
        }

        public Builder cpuUsageCores(Double cpuUsageCores) {
            this.cpuUsageCores = cpuUsageCores;
            return this;
        }

        public Builder memoryUsageBytes(Long memoryUsageBytes) {
            this.memoryUsageBytes = memoryUsageBytes;
            return this;
        }

        public Builder nodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public Builder placements(List<PodPlacement> placements) {
            this.placements = placements;
            return this;
        }

        public Builder containerUsage(List<ContainerUsage> containerUsage) {
            this.containerUsage = containerUsage;
            return this;
        }

        public Builder logs(String logs) {
            this.logs = logs;
            return this;
        }

        public MetricsSnapshot build() {
            return new MetricsSnapshot(
                    Optional.ofNullable(cpuRequestCores),
                    Optional.ofNullable(cpuLimitCores),
                    Optional.ofNullable(memoryRequestBytes),
                    Optional.ofNullable(memoryLimitBytes),
                    Optional.ofNullable(cpuUsageCores),
                    Optional.ofNullable(memoryUsageBytes),
                    Optional.ofNullable(nodeName),
                    Optional.ofNullable(placements),
                    Optional.ofNullable(containerUsage),
                    Optional.ofNullable(logs));
        }
    }
}
