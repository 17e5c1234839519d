package idlescope.core.config;

import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Price table for the built-in billing adapter.
 *
 * <p>Configuration prefix: {@code idlescope.billing}
 *
 * <pre>
 * idlescope.billing.default-hourly-price=0.10
 * idlescope.billing.instance-prices."m5.large"=0.096
 * idlescope.billing.instance-prices."e2-standard-4"=0.134
 * </pre>
 */
@ConfigMapping(prefix = "idlescope.billing")
public interface BillingConfig {

    /**
     * Hourly price of nodes whose instance type is not in the price table.
     *
     * @return price per hour (default: 0.10)
     */
    @WithDefault("0.10")
    double defaultHourlyPrice();

    /**
     * Hourly price per {@code node.kubernetes.io/instance-type} label value.
     */
    Map<String, Double> instancePrices();
}
