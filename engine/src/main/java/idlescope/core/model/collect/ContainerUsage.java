package idlescope.core.model.collect;

/**
 * Usage sample for a single container.
 */
public record ContainerUsage(String container, double cpuCores, long memoryBytes) {}
