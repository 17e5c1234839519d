package idlescope.adapter.out.collector;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import idlescope.adapter.out.kubernetes.KubernetesApiClient;
import idlescope.core.config.CollectionConfig;
import idlescope.core.config.KubernetesConfig;
import idlescope.core.model.collect.CollectorFailureKind;
import idlescope.core.model.collect.CollectorResult;
import idlescope.core.model.collect.CollectorSource;
import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.workload.TimeRange;
import idlescope.core.model.workload.WorkloadIdentifier;
import idlescope.testing.PodJson;

@DisplayName("CoreApiCollector")
@ExtendWith(MockitoExtension.class)
class CoreApiCollectorTest {

    private static final Duration AWAIT = Duration.ofSeconds(5);
    private static final long MIB = 1L << 20;
    private static final TimeRange RANGE =
            new TimeRange(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T06:00:00Z"));

    @Mock
    private KubernetesConfig kubernetesConfig;

    @Mock
    private CollectionConfig collectionConfig;

    private WireMockServer apiServer;
    private Vertx vertx;
    private CoreApiCollector collector;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        apiServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        apiServer.start();

        lenient().when(kubernetesConfig.apiUrl()).thenReturn(apiServer.baseUrl());
        lenient().when(kubernetesConfig.bearerToken()).thenReturn(Optional.empty());
        lenient().when(collectionConfig.collectorTimeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(collectionConfig.maxLogBytes()).thenReturn(4096L);
        lenient().when(collectionConfig.maxLogPods()).thenReturn(5);
        collector = new CoreApiCollector(
                new KubernetesApiClient(vertx, kubernetesConfig, collectionConfig), collectionConfig);
    }

    @AfterEach
    void tearDown() {
        if (apiServer != null) {
            apiServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private void stubJson(String path, String body) {
        apiServer.stubFor(get(urlPathEqualTo(path))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    private CollectorResult collect(WorkloadIdentifier workload) {
        return collector.collect(workload, RANGE).await().atMost(AWAIT);
    }

    private static MetricsSnapshot snapshot(CollectorResult result) {
        var success = assertInstanceOf(CollectorResult.Success.class, result);
        assertEquals(CollectorSource.CORE_API, success.source());
        return success.snapshot();
    }

    @Nested
    @DisplayName("Pods")
    class Pods {

        @Test
        @DisplayName("should report requests, limits, node and logs of a pod")
        void shouldReadPod() {
            var container = PodJson.withLimits(PodJson.container("app", "500m", "256Mi"), "1", "512Mi");
            stubJson(
                    "/api/v1/namespaces/shop/pods/web-1",
                    PodJson.pod("web-1", "node-a", "Running", container).encode());
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .willReturn(aResponse().withStatus(200).withBody("2024-01-01T01:00:00Z GET /api 200")));

            var snapshot = snapshot(collect(WorkloadIdentifier.pod("shop", "web-1")));

            assertEquals(Optional.of(0.5), snapshot.cpuRequestCores());
            assertEquals(Optional.of(256 * MIB), snapshot.memoryRequestBytes());
            assertEquals(Optional.of(1.0), snapshot.cpuLimitCores());
            assertEquals(Optional.of(512 * MIB), snapshot.memoryLimitBytes());
            assertEquals(Optional.of("node-a"), snapshot.nodeName());
            assertEquals(Optional.of("2024-01-01T01:00:00Z GET /api 200"), snapshot.logs());
            apiServer.verify(getRequestedFor(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .withQueryParam("timestamps", equalTo("true"))
                    .withQueryParam("sinceTime", equalTo("2024-01-01T00:00:00Z"))
                    .withQueryParam("limitBytes", equalTo("4096"))
                    .withQueryParam("container", equalTo("app")));
        }

        @Test
        @DisplayName("should read logs of the container that declares ports rather than a leading sidecar")
        void shouldReadServingContainerLogs() {
            stubJson(
                    "/api/v1/namespaces/shop/pods/web-1",
                    PodJson.pod(
                                    "web-1",
                                    "node-a",
                                    "Running",
                                    PodJson.container("proxy", "100m", "64Mi"),
                                    PodJson.withPort(PodJson.container("app", "500m", "256Mi"), 8080))
                            .encode());
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .willReturn(aResponse().withStatus(200).withBody("2024-01-01T01:00:00Z GET /api 200")));

            snapshot(collect(WorkloadIdentifier.pod("shop", "web-1")));

            apiServer.verify(getRequestedFor(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .withQueryParam("container", equalTo("app")));
        }

        @Test
        @DisplayName("should prefer the default container annotation")
        void shouldPreferAnnotatedContainer() {
            var pod = PodJson.pod(
                    "web-1",
                    "node-a",
                    "Running",
                    PodJson.withPort(PodJson.container("proxy", "100m", "64Mi"), 15001),
                    PodJson.container("app", "500m", "256Mi"));
            stubJson(
                    "/api/v1/namespaces/shop/pods/web-1",
                    PodJson.withAnnotation(pod, "kubectl.kubernetes.io/default-container", "app").encode());
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .willReturn(aResponse().withStatus(200).withBody("2024-01-01T01:00:00Z GET /api 200")));

            snapshot(collect(WorkloadIdentifier.pod("shop", "web-1")));

            apiServer.verify(getRequestedFor(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .withQueryParam("container", equalTo("app")));
        }

        @Test
        @DisplayName("should leave limits unset when a container has none")
        void shouldLeaveLimitsUnset() {
            stubJson(
                    "/api/v1/namespaces/shop/pods/web-1",
                    PodJson.pod("web-1", "node-a", "250m", "128Mi").encode());
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .willReturn(aResponse().withStatus(200).withBody("")));

            var snapshot = snapshot(collect(WorkloadIdentifier.pod("shop", "web-1")));

            assertTrue(snapshot.cpuLimitCores().isEmpty());
            assertTrue(snapshot.memoryLimitBytes().isEmpty());
        }

        @Test
        @DisplayName("should still answer when logs cannot be read")
        void shouldAnswerWithoutLogs() {
            stubJson(
                    "/api/v1/namespaces/shop/pods/web-1",
                    PodJson.pod("web-1", "node-a", "250m", "128Mi").encode());
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log"))
                    .willReturn(aResponse().withStatus(403)));

            var snapshot = snapshot(collect(WorkloadIdentifier.pod("shop", "web-1")));

            assertTrue(snapshot.logs().isEmpty());
            assertEquals(Optional.of(0.25), snapshot.cpuRequestCores());
        }

        @Test
        @DisplayName("should not fetch logs of an unscheduled pod")
        void shouldSkipLogsOfUnscheduledPod() {
            stubJson(
                    "/api/v1/namespaces/shop/pods/web-1",
                    PodJson.pod("web-1", null, "250m", "128Mi").encode());

            var snapshot = snapshot(collect(WorkloadIdentifier.pod("shop", "web-1")));

            assertTrue(snapshot.nodeName().isEmpty());
            assertTrue(snapshot.logs().isEmpty());
            apiServer.verify(0, getRequestedFor(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-1/log")));
        }

        @Test
        @DisplayName("should report a missing pod as unavailable")
        void shouldReportMissingPod() {
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/gone"))
                    .willReturn(aResponse().withStatus(404)));

            var failure = assertInstanceOf(
                    CollectorResult.Failure.class, collect(WorkloadIdentifier.pod("shop", "gone")));

            assertEquals(CollectorFailureKind.UNAVAILABLE, failure.kind());
        }
    }

    @Nested
    @DisplayName("Deployments and clusters")
    class Aggregates {

        @Test
        @DisplayName("should resolve replicas through the deployment selector")
        void shouldResolveReplicas() {
            var deployment = new JsonObject()
                    .put("spec", new JsonObject()
                            .put("selector", new JsonObject()
                                    .put("matchLabels", new JsonObject().put("app", "web").put("tier", "front"))));
            stubJson("/apis/apps/v1/namespaces/shop/deployments/web", deployment.encode());
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods"))
                    .withQueryParam("labelSelector", equalTo("app=web,tier=front"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withBody(PodJson.list(
                                    PodJson.pod("web-7d4b9c-a1", "node-a", "500m", "256Mi"),
                                    PodJson.pod("web-7d4b9c-b2", "node-b", "500m", "256Mi"),
                                    PodJson.pod("web-7d4b9c-old", "node-b", "Succeeded",
                                            PodJson.container("app", "500m", "256Mi"))))));
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-7d4b9c-a1/log"))
                    .willReturn(aResponse().withStatus(200).withBody("a")));
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/namespaces/shop/pods/web-7d4b9c-b2/log"))
                    .willReturn(aResponse().withStatus(200).withBody("b")));

            var snapshot = snapshot(collect(WorkloadIdentifier.deployment("shop", "web")));

            assertEquals(Optional.of(1.0), snapshot.cpuRequestCores());
            assertEquals(Optional.of(512 * MIB), snapshot.memoryRequestBytes());
            assertTrue(snapshot.nodeName().isEmpty());
            assertEquals(2, snapshot.placements().orElseThrow().size());
            assertEquals(Optional.of("a\nb"), snapshot.logs());
        }

        @Test
        @DisplayName("should report a deployment without matchLabels as unsupported")
        void shouldRejectSelectorlessDeployment() {
            stubJson("/apis/apps/v1/namespaces/shop/deployments/web", "{\"spec\": {}}");

            var failure = assertInstanceOf(
                    CollectorResult.Failure.class, collect(WorkloadIdentifier.deployment("shop", "web")));

            assertEquals(CollectorFailureKind.UNSUPPORTED, failure.kind());
        }

        @Test
        @DisplayName("should sum running pods of the cluster without reading logs")
        void shouldSumClusterPods() {
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/pods"))
                    .withQueryParam("fieldSelector", equalTo("status.phase=Running"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withBody(PodJson.list(
                                    PodJson.pod("a", "node-a", "1", "1Gi"),
                                    PodJson.pod("b", "node-a", "2", "1Gi")))));

            var snapshot = snapshot(collect(WorkloadIdentifier.cluster("prod")));

            assertEquals(Optional.of(3.0), snapshot.cpuRequestCores());
            assertEquals(Optional.of("node-a"), snapshot.nodeName());
            assertTrue(snapshot.logs().isEmpty());
        }
    }
}
