package idlescope.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Thresholds for idle detection and recommendations.
 *
 * <p>Configuration prefix: {@code idlescope.evaluation}
 */
@ConfigMapping(prefix = "idlescope.evaluation")
public interface EvaluationConfig {

    /**
     * CPU utilization under which a workload without business traffic is idle.
     *
     * @return threshold (default: 0.05)
     */
    @WithDefault("0.05")
    double idleCpuThreshold();

    /**
     * Business ratio under which activity counts as low.
     *
     * @return threshold (default: 0.3)
     */
    @WithDefault("0.3")
    double lowActivityRatio();

    /**
     * Business ratio above which activity counts as high.
     *
     * @return threshold (default: 0.7)
     */
    @WithDefault("0.7")
    double highActivityRatio();

    /**
     * CPU utilization under which a low-activity workload is idle.
     *
     * @return threshold (default: 0.2)
     */
    @WithDefault("0.2")
    double lowUtilizationThreshold();

    /**
     * Peak utilization under which rightsizing is suggested.
     *
     * @return threshold (default: 0.5)
     */
    @WithDefault("0.5")
    double rightsizeThreshold();

    /**
     * Peak utilization above which a workload counts as busy, lowering confidence in an idle verdict.
     *
     * @return threshold (default: 0.8)
     */
    @WithDefault("0.8")
    double highUtilizationThreshold();

    /**
     * Fraction of monthly cost saved by scaling an idle workload to zero.
     *
     * @return factor (default: 0.8)
     */
    @WithDefault("0.8")
    double scaleToZeroSavingsFactor();
}
