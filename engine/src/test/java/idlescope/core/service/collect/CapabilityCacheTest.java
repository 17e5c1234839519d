package idlescope.core.service.collect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

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
import idlescope.core.port.out.AssessmentMetrics;
import idlescope.core.port.out.ClusterCapabilityDetector;
import idlescope.testing.FakeTicker;

@DisplayName("CapabilityCache")
@ExtendWith(MockitoExtension.class)
class CapabilityCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final ClusterCapabilities FIRST =
            new ClusterCapabilities(true, false, CloudProviderKind.NONE, Instant.parse("2024-01-01T00:00:00Z"));
    private static final ClusterCapabilities SECOND =
            new ClusterCapabilities(true, true, CloudProviderKind.GCP, Instant.parse("2024-01-01T00:06:00Z"));

    @Mock
    private ClusterCapabilityDetector detector;

    @Mock
    private AssessmentMetrics metrics;

    private FakeTicker ticker;
    private CapabilityCache cache;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        cache = new CapabilityCache(detector, metrics, TTL, 10, ticker, Runnable::run);
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("should detect once and serve cached capabilities within the TTL")
        void shouldServeCachedWithinTtl() {
            when(detector.detect("prod")).thenReturn(Uni.createFrom().item(FIRST));

            var first = cache.get("prod").await().atMost(TIMEOUT);
            ticker.advance(Duration.ofMinutes(4));
            var second = cache.get("prod").await().atMost(TIMEOUT);

            assertEquals(FIRST, first);
            assertEquals(FIRST, second);
            verify(detector, times(1)).detect("prod");
        }

        @Test
        @DisplayName("should keep clusters apart")
        void shouldKeepClustersApart() {
            when(detector.detect("prod")).thenReturn(Uni.createFrom().item(FIRST));
            when(detector.detect("staging")).thenReturn(Uni.createFrom().item(SECOND));

            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));
            assertEquals(SECOND, cache.get("staging").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Refresh")
    class Refresh {

        @Test
        @DisplayName("should return the stale value while a refresh is in progress")
        void shouldReturnStaleDuringRefresh() {
            var pending = new CompletableFuture<ClusterCapabilities>();
            when(detector.detect("prod"))
                    .thenReturn(Uni.createFrom().item(FIRST), Uni.createFrom().completionStage(pending));

            cache.get("prod").await().atMost(TIMEOUT);
            ticker.advance(TTL.plusSeconds(1));

            // refresh starts but has not finished
            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));
            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));

            pending.complete(SECOND);

            assertEquals(SECOND, cache.get("prod").await().atMost(TIMEOUT));
            verify(detector, times(2)).detect("prod");
        }

        @Test
        @DisplayName("should keep the previous value when a refresh fails")
        void shouldKeepPreviousValueOnFailedRefresh() {
            when(detector.detect("prod"))
                    .thenReturn(
                            Uni.createFrom().item(FIRST),
                            Uni.createFrom().failure(new IllegalStateException("api down")));

            cache.get("prod").await().atMost(TIMEOUT);
            ticker.advance(TTL.plusSeconds(1));

            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));
            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));
            verify(metrics, never()).recordCapabilityFallback("prod");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fall back to core-only capabilities without caching the failure")
        void shouldFallBackWithoutCaching() {
            when(detector.detect("prod"))
                    .thenReturn(
                            Uni.createFrom().failure(new IllegalStateException("api down")),
                            Uni.createFrom().item(FIRST));

            var fallback = cache.get("prod").await().atMost(TIMEOUT);

            assertFalse(fallback.hasMetricsAggregator());
            assertFalse(fallback.hasQueryEngine());
            assertEquals(CloudProviderKind.NONE, fallback.cloudProvider());
            verify(metrics).recordCapabilityFallback("prod");

            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));
            verify(detector, times(2)).detect("prod");
        }

        @Test
        @DisplayName("should not let a cancelled caller cancel the shared detection")
        void shouldNotCancelSharedDetection() {
            var pending = new CompletableFuture<ClusterCapabilities>();
            when(detector.detect("prod")).thenReturn(Uni.createFrom().completionStage(pending));

            cache.get("prod").subscribe().with(item -> {}).cancel();
            pending.complete(FIRST);

            assertFalse(pending.isCancelled());
            assertEquals(FIRST, cache.get("prod").await().atMost(TIMEOUT));
            verify(detector, times(1)).detect("prod");
        }
    }

    @Test
    @DisplayName("should expose completed detections through peek")
    void shouldPeekCompletedDetections() {
        when(detector.detect("prod")).thenReturn(Uni.createFrom().item(FIRST));

        assertTrue(cache.peek("prod").isEmpty());
        cache.get("prod").await().atMost(TIMEOUT);

        assertEquals(FIRST, cache.peek("prod").orElseThrow());

        cache.invalidate("prod");
        assertTrue(cache.peek("prod").isEmpty());
    }
}
