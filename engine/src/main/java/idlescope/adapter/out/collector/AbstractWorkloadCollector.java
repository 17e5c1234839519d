package idlescope.adapter.out.collector;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import io.smallrye.mutiny.Uni;
import io.vertx.core.VertxException;
import io.vertx.core.json.DecodeException;
import org.jboss.logging.Logger;

import idlescope.adapter.out.kubernetes.KubernetesApiException;
import idlescope.core.model.collect.CollectorFailureKind;
import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.port.out.WorkloadCollector;

/**
 * Base class for HTTP-backed collectors.
 *
 * <p>Subclasses fetch a {@link MetricsSnapshot} and may fail freely; this
 * class turns every failure into a typed {@link CollectorResult.Failure}.
 */
public abstract class AbstractWorkloadCollector implements WorkloadCollector {

    private static final Logger LOG = Logger.getLogger(AbstractWorkloadCollector.class);

    @Override
    public final Uni<CollectorResult> collect(WorkloadIdentifier workload, TimeRange range) {
        if (!supports(workload.kind())) {
            return Uni.createFrom()
                    .item(CollectorResult.unsupported(source(), workload.kind() + " workloads are not supported"));
        }
        return Uni.createFrom()
                .deferred(() -> fetch(workload, range))
                .map(snapshot -> CollectorResult.success(source(), snapshot))
                .onFailure()
                .recoverWithItem(error -> toFailure(workload, error));
    }

    /**
     * Query the backend for one workload.
     */
    protected abstract Uni<MetricsSnapshot> fetch(WorkloadIdentifier workload, TimeRange range);

    CollectorResult toFailure(WorkloadIdentifier workload, Throwable error) {
        LOG.debugf(error, "%s collection failed for %s", source().tag(), workload);
        var message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new CollectorResult.Failure(source(), kindOf(error), message);
    }

    static CollectorFailureKind kindOf(Throwable error) {
        if (error instanceof CollectorException collectorError) {
            return collectorError.kind();
        }
        if (error instanceof TimeoutException) {
            return CollectorFailureKind.TIMEOUT;
        }
        if (error instanceof DecodeException) {
            return CollectorFailureKind.ERROR;
        }
        if (error instanceof KubernetesApiException
                || error instanceof IOException
                || error instanceof VertxException) {
            return CollectorFailureKind.UNAVAILABLE;
        }
        return CollectorFailureKind.ERROR;
    }
}
