package idlescope.core.service.collect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import idlescope.core.model.collect.CloudProviderKind;
import idlescope.core.model.collect.ClusterCapabilities;
import idlescope.core.model.collect.CollectorFailureKind;
import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.ExecutionContext;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.core.model.workload.WorkloadKind;
import idlescope.core.port.out.AssessmentMetrics;
import idlescope.core.port.out.ClusterCapabilityDetector;
import idlescope.core.port.out.WorkloadCollector;
import idlescope.testing.FakeTicker;
import idlescope.testing.StubCollector;

@DisplayName("CollectorRegistry")
@ExtendWith(MockitoExtension.class)
class CollectorRegistryTest {

    private static final WorkloadIdentifier POD = WorkloadIdentifier.pod("shop", "web-1");
    private static final TimeRange RANGE =
            new TimeRange(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T01:00:00Z"));
    private static final ExecutionContext CONTEXT = new ExecutionContext("prod", "ops");
    private static final Duration COLLECTOR_TIMEOUT = Duration.ofMillis(200);

    private static final ClusterCapabilities ALL =
            new ClusterCapabilities(true, true, CloudProviderKind.AWS, Instant.now());

    @Mock
    private ClusterCapabilityDetector detector;

    @Mock
    private AssessmentMetrics metrics;

    private CapabilityCache capabilityCache;

    @BeforeEach
    void setUp() {
        capabilityCache = new CapabilityCache(detector, metrics, Duration.ofMinutes(5), 10, new FakeTicker(), Runnable::run);
        lenient().when(detector.detect("prod")).thenReturn(Uni.createFrom().item(ALL));
    }

    private CollectorRegistry registry(WorkloadCollector... collectors) {
        return new CollectorRegistry(List.of(collectors), capabilityCache, COLLECTOR_TIMEOUT, metrics);
    }

    private static MetricsSnapshot cpu(double cores) {
        return MetricsSnapshot.builder().cpuUsageCores(cores).build();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should require a core API collector")
        void shouldRequireCoreApiCollector() {
            var aggregator = StubCollector.answering(CollectorSource.AGGREGATOR, cpu(0.1));

            assertThrows(IllegalStateException.class, () -> registry(aggregator));
        }

        @Test
        @DisplayName("should keep one collector per source, in priority order")
        void shouldKeepOnePerSource() {
            var prometheus = StubCollector.answering(CollectorSource.QUERY_ENGINE, cpu(0.3));
            var core = StubCollector.answering(CollectorSource.CORE_API, MetricsSnapshot.empty());
            var duplicate = StubCollector.answering(CollectorSource.QUERY_ENGINE, cpu(0.9));
            var aggregator = StubCollector.answering(CollectorSource.AGGREGATOR, cpu(0.2));

            var registry = registry(prometheus, core, duplicate, aggregator);

            assertEquals(List.of(core, aggregator, prometheus), registry.registeredCollectors());
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        private final StubCollector core = StubCollector.answering(CollectorSource.CORE_API, MetricsSnapshot.empty());
        private final StubCollector aggregator = StubCollector.answering(CollectorSource.AGGREGATOR, cpu(0.1));
        private final StubCollector prometheus = StubCollector.answering(CollectorSource.QUERY_ENGINE, cpu(0.2));
        private final StubCollector nodeAgent =
                StubCollector.answering(CollectorSource.NODE_AGENT, cpu(0.3)).onlyFor(WorkloadKind.POD);
        private final StubCollector cloud = StubCollector.answering(CollectorSource.CLOUD_TELEMETRY, cpu(0.4));

        @Test
        @DisplayName("should select only the core API collector for a bare cluster")
        void shouldSelectCoreOnly() {
            var registry = registry(core, aggregator, prometheus, cloud);

            var selected = registry.select(ClusterCapabilities.coreOnly(), WorkloadKind.POD);

            assertEquals(List.of(core), selected);
        }

        @Test
        @DisplayName("should select collectors backed by detected capabilities")
        void shouldSelectByCapabilities() {
            var registry = registry(core, aggregator, prometheus, nodeAgent, cloud);
            var capabilities = new ClusterCapabilities(true, false, CloudProviderKind.GCP, Instant.now());

            var selected = registry.select(capabilities, WorkloadKind.POD);

            assertEquals(List.of(core, aggregator, nodeAgent, cloud), selected);
        }

        @Test
        @DisplayName("should skip collectors that do not support the workload kind")
        void shouldSkipUnsupportedKinds() {
            var registry = registry(core, aggregator, nodeAgent);

            var selected = registry.select(ALL, WorkloadKind.DEPLOYMENT);

            assertEquals(List.of(core, aggregator), selected);
        }

        @Test
        @DisplayName("should skip disabled collectors and collectors without workload or log queries")
        void shouldSkipDisabledAndIncapable() {
            var disabledPrometheus = StubCollector.answering(CollectorSource.QUERY_ENGINE, cpu(0.2)).disabled();
            var nodeOnly = StubCollector.answering(CollectorSource.NODE_AGENT, cpu(0.3)).withoutCapabilities();
            var logsOnly = StubCollector.answering(CollectorSource.CLOUD_TELEMETRY, cpu(0.4)).logsOnly();
            var registry = registry(core, disabledPrometheus, nodeOnly, logsOnly);

            var selected = registry.select(ALL, WorkloadKind.POD);

            assertEquals(List.of(core, logsOnly), selected);
        }

        @Test
        @DisplayName("should dispatch only selected collectors")
        void shouldDispatchSelected() {
            when(detector.detect("staging"))
                    .thenReturn(Uni.createFrom().item(ClusterCapabilities.coreOnly()));
            var registry = registry(core, aggregator, prometheus);

            var results = registry.collect(POD, RANGE, new ExecutionContext("staging", "ops"))
                    .await()
                    .atMost(Duration.ofSeconds(5));

            assertEquals(1, results.size());
            assertEquals(CollectorSource.CORE_API, results.get(0).source());
            assertEquals(0, aggregator.calls());
            assertEquals(0, prometheus.calls());
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("should return one result per collector in priority order")
        void shouldReturnResultsInPriorityOrder() {
            var registry = registry(
                    StubCollector.answering(CollectorSource.QUERY_ENGINE, cpu(0.3)),
                    StubCollector.answering(CollectorSource.CORE_API, MetricsSnapshot.empty()),
                    StubCollector.answering(CollectorSource.AGGREGATOR, cpu(0.2)));

            var results = registry.collect(POD, RANGE, CONTEXT).await().atMost(Duration.ofSeconds(5));

            assertEquals(
                    List.of(CollectorSource.CORE_API, CollectorSource.AGGREGATOR, CollectorSource.QUERY_ENGINE),
                    results.stream().map(CollectorResult::source).toList());
            assertTrue(results.stream().allMatch(CollectorResult::isSuccess));
            verify(metrics, times(3)).recordCollectorResult(any(), anyLong());
        }

        @Test
        @DisplayName("should convert failed and throwing collectors into typed failures")
        void shouldConvertErrors() {
            var registry = registry(
                    StubCollector.answering(CollectorSource.CORE_API, MetricsSnapshot.empty()),
                    StubCollector.failing(CollectorSource.AGGREGATOR, new IllegalStateException("boom")),
                    StubCollector.throwing(CollectorSource.QUERY_ENGINE, new IllegalArgumentException("bad")));

            var results = registry.collect(POD, RANGE, CONTEXT).await().atMost(Duration.ofSeconds(5));

            assertTrue(results.get(0).isSuccess());
            var failed = assertInstanceOf(CollectorResult.Failure.class, results.get(1));
            assertEquals(CollectorFailureKind.ERROR, failed.kind());
            assertEquals("boom", failed.message());
            var thrown = assertInstanceOf(CollectorResult.Failure.class, results.get(2));
            assertEquals(CollectorFailureKind.ERROR, thrown.kind());
        }

        @Test
        @DisplayName("should keep typed failures reported by collectors")
        void shouldKeepReportedFailures() {
            var registry = registry(
                    StubCollector.answering(CollectorSource.CORE_API, MetricsSnapshot.empty()),
                    StubCollector.unavailable(CollectorSource.AGGREGATOR));

            var results = registry.collect(POD, RANGE, CONTEXT).await().atMost(Duration.ofSeconds(5));

            var failed = assertInstanceOf(CollectorResult.Failure.class, results.get(1));
            assertEquals(CollectorFailureKind.UNAVAILABLE, failed.kind());
        }
    }

    @Nested
    @DisplayName("Timeouts and cancellation")
    class TimeoutsAndCancellation {

        @Test
        @DisplayName("should terminate within the collector timeout when every collector hangs")
        void shouldTerminateWhenAllHang() {
            var core = StubCollector.hanging(CollectorSource.CORE_API);
            var aggregator = StubCollector.hanging(CollectorSource.AGGREGATOR);
            var prometheus = StubCollector.hanging(CollectorSource.QUERY_ENGINE);
            var registry = registry(core, aggregator, prometheus);

            var started = System.nanoTime();
            var results = registry.collect(POD, RANGE, CONTEXT).await().atMost(Duration.ofSeconds(5));
            var elapsed = Duration.ofNanos(System.nanoTime() - started);

            assertEquals(3, results.size());
            results.forEach(result -> assertEquals(
                    CollectorFailureKind.TIMEOUT,
                    assertInstanceOf(CollectorResult.Failure.class, result).kind()));
            assertTrue(elapsed.compareTo(Duration.ofSeconds(3)) < 0, "took " + elapsed);
        }

        @Test
        @DisplayName("should deliver fast results alongside timeouts of slow collectors")
        void shouldMixTimeoutsAndResults() {
            var registry = registry(
                    StubCollector.answering(CollectorSource.CORE_API, MetricsSnapshot.empty()),
                    StubCollector.hanging(CollectorSource.AGGREGATOR));

            var results = registry.collect(POD, RANGE, CONTEXT).await().atMost(Duration.ofSeconds(5));

            assertTrue(results.get(0).isSuccess());
            assertEquals(
                    CollectorFailureKind.TIMEOUT,
                    assertInstanceOf(CollectorResult.Failure.class, results.get(1)).kind());
        }

        @Test
        @DisplayName("should cancel every pending collector when the caller cancels")
        void shouldPropagateCancellation() {
            var core = StubCollector.hanging(CollectorSource.CORE_API);
            var aggregator = StubCollector.hanging(CollectorSource.AGGREGATOR);
            var registry = new CollectorRegistry(
                    List.of(core, aggregator), capabilityCache, Duration.ofMinutes(1), metrics);

            var subscription = registry.collect(POD, RANGE, CONTEXT).subscribe().with(results -> {});
            subscription.cancel();

            assertTrue(core.wasCancelled());
            assertTrue(aggregator.wasCancelled());
        }
    }
}
