package idlescope.core.service.assessment;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import idlescope.core.config.CollectionConfig;
import idlescope.core.model.activity.BusinessActivity;
import idlescope.core.model.assessment.AssessmentOutcome;
import idlescope.core.model.assessment.AssessmentResult;
import idlescope.core.model.assessment.PipelineStage;
import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.WorkloadMetrics;
import idlescope.core.model.common.ValidationResult;
import idlescope.core.model.cost.ClusterCostBreakdown;
import idlescope.core.model.cost.CostResult;
import idlescope.core.model.cost.CostUnavailableReason;
import idlescope.core.model.cost.NodeCostInfo;
import idlescope.core.model.workload.ExecutionContext;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.port.in.AssessmentUseCase;
import idlescope.core.port.out.AssessmentMetrics;
import idlescope.core.port.out.BillingClient;
import idlescope.core.service.activity.BusinessActivityClassifier;
import idlescope.core.service.activity.RequestLogExtractor;
import idlescope.core.service.collect.CollectorRegistry;
import idlescope.core.service.collect.MetricsMerger;
import idlescope.core.service.cost.CostAttributionEngine;

/**
 * Runs the assessment pipeline for one workload.
 *
 * <p>Stages: collect from every applicable source concurrently, merge by
 * source priority, extract and classify request logs, attribute cost, then
 * evaluate. Partial collection and unavailable billing degrade the result
 * instead of failing the run; only unexpected errors produce
 * {@link AssessmentOutcome.Failed}.
 *
 * <p>Cancelling the returned {@link Uni} cancels every pending collector and
 * billing call.
 */
@ApplicationScoped
public class AssessmentService implements AssessmentUseCase {

    private static final Logger LOG = Logger.getLogger(AssessmentService.class);

    private final AssessmentRequestValidator validator;
    private final CollectorRegistry registry;
    private final MetricsMerger merger;
    private final RequestLogExtractor extractor;
    private final BusinessActivityClassifier classifier;
    private final CostAttributionEngine costEngine;
    private final WorkloadEvaluator evaluator;
    private final BillingClient billingClient;
    private final AssessmentMetrics metrics;
    private final Duration billingTimeout;

    @Inject
    public AssessmentService(
            AssessmentRequestValidator validator,
            CollectorRegistry registry,
            MetricsMerger merger,
            RequestLogExtractor extractor,
            BusinessActivityClassifier classifier,
            CostAttributionEngine costEngine,
            WorkloadEvaluator evaluator,
            BillingClient billingClient,
            AssessmentMetrics metrics,
            CollectionConfig config) {
        this.validator = validator;
        this.registry = registry;
        this.merger = merger;
        this.extractor = extractor;
        this.classifier = classifier;
        this.costEngine = costEngine;
        this.evaluator = evaluator;
        this.billingClient = billingClient;
        this.metrics = metrics;
        this.billingTimeout = config.billingTimeout();
    }

    @Override
    public Uni<AssessmentOutcome> assess(WorkloadIdentifier workload, TimeRange range, ExecutionContext context) {
        var validation = validator.validate(workload, range, context);
        if (validation instanceof ValidationResult.Invalid invalid) {
            LOG.infof("Rejected assessment of %s: %s", workload, invalid.reason());
            AssessmentOutcome rejected = new AssessmentOutcome.Rejected(invalid.reason());
            metrics.recordAssessment(rejected, 0);
            return Uni.createFrom().item(rejected);
        }
        return Uni.createFrom().deferred(() -> run(new PipelineRun(workload), workload, range, context));
    }

    private Uni<AssessmentOutcome> run(
            PipelineRun run, WorkloadIdentifier workload, TimeRange range, ExecutionContext context) {
        LOG.debugf("Assessing %s over [%s, %s) for %s", workload, range.start(), range.end(), context.principal());
        run.advance(PipelineStage.COLLECTING);
        return Uni.createFrom()
                .deferred(() -> registry.collect(workload, range, context))
                .map(results -> mergeAndClassify(run, workload, range, results))
                .flatMap(classified -> {
                    run.advance(PipelineStage.ATTRIBUTING);
                    return attribute(classified.metrics(), range, context)
                            .map(cost -> complete(run, classified, cost));
                })
                .onFailure()
                .recoverWithItem(error -> fail(run, workload, error))
                .invoke(outcome -> metrics.recordAssessment(outcome, run.elapsedMillis()));
    }

    private Classified mergeAndClassify(
            PipelineRun run, WorkloadIdentifier workload, TimeRange range, List<CollectorResult> results) {
        run.advance(PipelineStage.MERGING);
        var merged = merger.merge(workload, range, results);
        run.advance(PipelineStage.CLASSIFYING);
        var activity = merged.values()
                .logs()
                .map(logs -> classifier.classify(extractor.extract(logs, range)))
                .orElseGet(BusinessActivity::empty);
        return new Classified(merged, activity);
    }

    private Uni<CostResult> attribute(WorkloadMetrics merged, TimeRange range, ExecutionContext context) {
        if (merged.noData()) {
            return Uni.createFrom()
                    .item(CostResult.unavailable(
                            CostUnavailableReason.NO_METRICS, "No metrics collected for " + merged.workload()));
        }
        Uni<Optional<List<NodeCostInfo>>> nodeCosts = Uni.createFrom()
                .deferred(() -> billingClient.getNodeCosts(context.clusterId(), range))
                .ifNoItem()
                .after(billingTimeout)
                .fail()
                .map(Optional::ofNullable)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Node costs unavailable for cluster %s: %s", context.clusterId(), error.toString());
                    return Optional.empty();
                });
        Uni<Optional<ClusterCostBreakdown>> clusterCosts = Uni.createFrom()
                .deferred(() -> billingClient.getClusterCosts(range))
                .ifNoItem()
                .after(billingTimeout)
                .fail()
                .map(Optional::ofNullable)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Cluster costs unavailable for cluster %s: %s", context.clusterId(), error.toString());
                    return Optional.empty();
                });

        return Uni.combine().all().unis(nodeCosts, clusterCosts).asTuple().map(costs -> {
            var nodes = costs.getItem1();
            if (nodes.isEmpty()) {
                return CostResult.unavailable(
                        CostUnavailableReason.BILLING_UNREACHABLE,
                        "Billing collaborator did not answer for cluster " + context.clusterId());
            }
            return costEngine.attribute(merged, nodes.get(), costs.getItem2());
        });
    }

    private AssessmentOutcome complete(PipelineRun run, Classified classified, CostResult cost) {
        var merged = classified.metrics();
        var evaluation = evaluator.evaluate(merged, classified.activity(), cost);
        run.advance(PipelineStage.DONE);
        var result = new AssessmentResult(
                merged.workload(),
                merged.range(),
                merged,
                classified.activity(),
                cost,
                evaluation.idle(),
                evaluation.recommendation(),
                evaluation.confidence(),
                run.history(),
                Instant.now());
        LOG.infof(
                "Assessed %s in %dms: %s, confidence %.2f, sources %s, cost %s",
                merged.workload(),
                run.elapsedMillis(),
                evaluation.recommendation().action(),
                evaluation.confidence(),
                merged.successfulSources(),
                cost.isAvailable() ? "attributed" : "unavailable");
        return new AssessmentOutcome.Completed(result);
    }

    private AssessmentOutcome fail(PipelineRun run, WorkloadIdentifier workload, Throwable error) {
        var stage = run.fail();
        LOG.errorf(error, "Assessment of %s failed during %s", workload, stage);
        var message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new AssessmentOutcome.Failed(stage, message);
    }

    private record Classified(WorkloadMetrics metrics, BusinessActivity activity) {}
}
