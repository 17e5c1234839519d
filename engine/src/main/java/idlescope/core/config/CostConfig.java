package idlescope.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Cost attribution weights and projection periods.
 *
 * <p>Configuration prefix: {@code idlescope.cost}
 *
 * <p>The CPU weight is higher than the memory weight because CPU is usually
 * the more expensive resource per unit. The weights are tunable constants.
 */
@ConfigMapping(prefix = "idlescope.cost")
public interface CostConfig {

    /**
     * @return weight of the CPU ratio (default: 0.6)
     */
    @WithDefault("0.6")
    double cpuWeight();

    /**
     * @return weight of the memory ratio (default: 0.4)
     */
    @WithDefault("0.4")
    double memoryWeight();

    @WithDefault("24")
    int hoursPerDay();

    /**
     * @return days used for the monthly projection (default: 30)
     */
    @WithDefault("30")
    int daysPerMonth();

    @WithDefault("USD")
    String currency();
}
