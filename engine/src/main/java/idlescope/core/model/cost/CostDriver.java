package idlescope.core.model.cost;

/**
 * Part of the hourly share caused by one resource.
 *
 * @param resource   resource name ({@code cpu}, {@code memory}, {@code node})
 * @param share      weighted fraction of node capacity
 * @param hourlyCost hourly cost attributed to the resource
 */
public record CostDriver(String resource, double share, double hourlyCost) {}
