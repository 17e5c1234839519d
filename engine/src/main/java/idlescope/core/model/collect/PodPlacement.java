package idlescope.core.model.collect;

import java.util.Objects;

/**
 * One replica of a workload and the node it is scheduled on.
 *
 * @param podName            pod name
 * @param nodeName           node name, empty when not yet scheduled
 * @param cpuRequestCores    summed container CPU requests in cores
 * @param memoryRequestBytes summed container memory requests in bytes
 */
public record PodPlacement(String podName, String nodeName, double cpuRequestCores, long memoryRequestBytes) {

    public PodPlacement {
        Objects.requireNonNull(podName, "podName cannot be null");
        nodeName = nodeName == null ? "" : nodeName;
    }

    public boolean isScheduled() {
        return !nodeName.isBlank();
    }
}
