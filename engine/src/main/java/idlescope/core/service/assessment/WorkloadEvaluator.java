package idlescope.core.service.assessment;

import java.util.ArrayList;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import idlescope.core.config.EvaluationConfig;
import idlescope.core.model.activity.BusinessActivity;
import idlescope.core.model.assessment.IdleAnalysis;
import idlescope.core.model.assessment.Recommendation;
import idlescope.core.model.assessment.RecommendedAction;
import idlescope.core.model.assessment.WorkloadEvaluation;
import idlescope.core.model.collect.WorkloadMetrics;
import idlescope.core.model.cost.CostResult;

/**
 * Derives the idle verdict, a recommendation and a confidence score.
 *
 * <p>Utilization is usage over request. Request logs only count as evidence
 * when a source actually returned logs; a workload without logs is judged on
 * utilization alone.
 */
@ApplicationScoped
public class WorkloadEvaluator {

    private final EvaluationConfig config;

    @Inject
    public WorkloadEvaluator(EvaluationConfig config) {
        this.config = config;
    }

    public WorkloadEvaluation evaluate(WorkloadMetrics metrics, BusinessActivity activity, CostResult cost) {
        if (metrics.noData()) {
            return new WorkloadEvaluation(
                    IdleAnalysis.unknown("No telemetry source could measure the workload"),
                    new Recommendation(
                            RecommendedAction.INSUFFICIENT_DATA,
                            Optional.empty(),
                            "Not enough data to recommend an action"),
                    0.0);
        }
        var idle = analyzeIdle(metrics, activity);
        return new WorkloadEvaluation(idle, recommend(idle, cost), confidence(metrics, activity, idle, cost));
    }

    IdleAnalysis analyzeIdle(WorkloadMetrics metrics, BusinessActivity activity) {
        var values = metrics.values();
        var cpu = utilization(values.cpuUsageCores(), values.cpuRequestCores());
        var memory = utilization(
                values.memoryUsageBytes().map(Long::doubleValue), values.memoryRequestBytes().map(Long::doubleValue));
        var logsObserved = values.logs().isPresent();
        var reasons = new ArrayList<String>();

        var noBusinessTraffic = logsObserved && activity.businessRequests() == 0;
        var quiet = noBusinessTraffic && cpu.map(u -> u < config.idleCpuThreshold()).orElse(true);
        var lowActivity = logsObserved
                && activity.businessRatio() < config.lowActivityRatio()
                && cpu.map(u -> u < config.lowUtilizationThreshold()).orElse(false);
        var unobservedIdle = !logsObserved && cpu.map(u -> u < config.idleCpuThreshold()).orElse(false);

        if (noBusinessTraffic) {
            reasons.add("No business requests in " + activity.totalRequests() + " logged requests");
        } else if (logsObserved) {
            reasons.add(String.format(
                    "%d of %d requests are business traffic (ratio %.2f)",
                    activity.businessRequests(), activity.totalRequests(), activity.businessRatio()));
        } else {
            reasons.add("No request logs available");
        }
        cpu.ifPresentOrElse(
                u -> reasons.add(String.format("CPU utilization %.1f%% of request", u * 100)),
                () -> reasons.add("CPU utilization unknown"));
        memory.ifPresent(u -> reasons.add(String.format("Memory utilization %.1f%% of request", u * 100)));

        return new IdleAnalysis(quiet || lowActivity || unobservedIdle, cpu, memory, reasons);
    }

    Recommendation recommend(IdleAnalysis idle, CostResult cost) {
        var monthly = cost.attributedBreakdown().map(b -> b.monthlyProjection());
        if (idle.idle()) {
            return new Recommendation(
                    RecommendedAction.SCALE_TO_ZERO,
                    monthly.map(m -> m * config.scaleToZeroSavingsFactor()),
                    "Workload is idle; scale to zero or schedule it off when unused");
        }
        var peak = idle.peakUtilization();
        if (peak.isPresent() && peak.get() < config.rightsizeThreshold()) {
            var utilization = peak.get();
            return new Recommendation(
                    RecommendedAction.RIGHTSIZE,
                    monthly.map(m -> m * (1.0 - utilization)),
                    String.format("Peak utilization %.1f%% of requests; lower the requests", utilization * 100));
        }
        return new Recommendation(
                RecommendedAction.NO_ACTION, monthly.map(m -> 0.0), "Workload is active and well utilized");
    }

    double confidence(WorkloadMetrics metrics, BusinessActivity activity, IdleAnalysis idle, CostResult cost) {
        var score = 0.5;
        if (metrics.values().logs().isPresent()) {
            if (activity.businessRatio() < config.lowActivityRatio()) {
                score += 0.2;
            } else if (activity.businessRatio() > config.highActivityRatio()) {
                score -= 0.1;
            }
            score += 0.1;
        }
        var peak = idle.peakUtilization();
        if (peak.isPresent()) {
            if (peak.get() < config.rightsizeThreshold()) {
                score += 0.2;
            } else if (peak.get() > config.highUtilizationThreshold()) {
                score -= 0.1;
            }
        }
        var dispatched = metrics.dispatchedSources();
        if (dispatched > 0) {
            score *= (double) metrics.successfulSources().size() / dispatched;
        }
        if (!cost.isAvailable()) {
            score -= 0.1;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static Optional<Double> utilization(Optional<Double> usage, Optional<Double> request) {
        if (usage.isEmpty() || request.isEmpty() || request.get() <= 0) {
            return Optional.empty();
        }
        return Optional.of(usage.get() / request.get());
    }
}
