package idlescope.core.model.cost;

import java.util.Objects;

/**
 * Price and capacity of a node, as reported by the billing collaborator.
 *
 * @param nodeName          node name
 * @param hourlyCost        price per hour
 * @param allocatableCpu    allocatable CPU in cores
 * @param allocatableMemory allocatable memory in bytes
 */
public record NodeCostInfo(String nodeName, double hourlyCost, double allocatableCpu, long allocatableMemory) {

    public NodeCostInfo {
        Objects.requireNonNull(nodeName, "nodeName cannot be null");
        if (hourlyCost < 0) {
            throw new IllegalArgumentException("hourlyCost cannot be negative: " + hourlyCost);
        }
    }
}
