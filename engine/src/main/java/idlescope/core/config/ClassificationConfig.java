package idlescope.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Exclusion lists used to separate business traffic from probes and monitoring.
 *
 * <p>Configuration prefix: {@code idlescope.classification}
 *
 * <p>Lists are comma separated and can be tuned per deployment without a rebuild.
 */
@ConfigMapping(prefix = "idlescope.classification")
public interface ClassificationConfig {

    /**
     * Paths that are always probes. Compared case-insensitively against the path without query string.
     */
    @WithDefault("/health,/healthz,/health/live,/health/ready,/ready,/readyz,/live,/livez,/liveness,/readiness,"
            + "/metrics,/ping,/status,/q/health,/q/metrics,/actuator/health,/actuator/prometheus")
    List<String> probePaths();

    /**
     * User-agent tokens of probes, monitoring agents and load-balancer health checks.
     * Matched as case-insensitive substrings.
     */
    @WithDefault("kube-probe,prometheus,googlehc,elb-healthchecker,health-check,healthcheck,datadog,newrelic,"
            + "pingdom,uptimerobot,blackbox-exporter,zabbix,nagios,statuscake,site24x7")
    List<String> monitoringAgents();

    /**
     * Regular expressions matching user agents of internal cluster clients.
     */
    @WithDefault("^kubelet/.*,^kube-controller-manager/.*,^kube-scheduler/.*,^istio-envoy.*,^linkerd-proxy.*,"
            + "^consul-template.*,^Envoy/HC$")
    List<String> internalClients();
}
