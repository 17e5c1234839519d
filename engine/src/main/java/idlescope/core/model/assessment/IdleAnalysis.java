package idlescope.core.model.assessment;

import java.util.List;
import java.util.Optional;

/**
 * Whether a workload looks idle, and why.
 *
 * @param idle              idle verdict
 * @param cpuUtilization    CPU usage over CPU request, when both are known
 * @param memoryUtilization memory usage over memory request, when both are known
 * @param reasons           human-readable findings behind the verdict
 */
public record IdleAnalysis(
        boolean idle, Optional<Double> cpuUtilization, Optional<Double> memoryUtilization, List<String> reasons) {

    public IdleAnalysis {
        cpuUtilization = cpuUtilization == null ? Optional.empty() : cpuUtilization;
        memoryUtilization = memoryUtilization == null ? Optional.empty() : memoryUtilization;
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    /**
     * Highest known utilization across CPU and memory.
     */
    public Optional<Double> peakUtilization() {
        if (cpuUtilization.isPresent() && memoryUtilization.isPresent()) {
            return Optional.of(Math.max(cpuUtilization.get(), memoryUtilization.get()));
        }
        return cpuUtilization.isPresent() ? cpuUtilization : memoryUtilization;
    }

    public static IdleAnalysis unknown(String reason) {
        return new IdleAnalysis(false, Optional.empty(), Optional.empty(), List.of(reason));
    }
}
