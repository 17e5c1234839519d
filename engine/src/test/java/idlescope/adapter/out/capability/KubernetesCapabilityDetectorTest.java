package idlescope.adapter.out.capability;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.core.json.JsonArray;
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
import idlescope.adapter.out.kubernetes.KubernetesApiException;
import idlescope.core.config.CollectionConfig;
import idlescope.core.config.CollectorsConfig;
import idlescope.core.config.KubernetesConfig;
import idlescope.core.model.collect.CloudProviderKind;

@DisplayName("KubernetesCapabilityDetector")
@ExtendWith(MockitoExtension.class)
class KubernetesCapabilityDetectorTest {

    private static final Duration AWAIT = Duration.ofSeconds(5);

    @Mock
    private KubernetesConfig kubernetesConfig;

    @Mock
    private CollectionConfig collectionConfig;

    @Mock
    private CollectorsConfig collectorsConfig;

    @Mock
    private CollectorsConfig.Prometheus prometheusConfig;

    private WireMockServer apiServer;
    private WireMockServer prometheus;
    private Vertx vertx;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        apiServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        apiServer.start();
        prometheus = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        prometheus.start();

        lenient().when(kubernetesConfig.apiUrl()).thenReturn(apiServer.baseUrl());
        lenient().when(kubernetesConfig.bearerToken()).thenReturn(Optional.empty());
        lenient().when(collectionConfig.collectorTimeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(collectorsConfig.prometheus()).thenReturn(prometheusConfig);
    }

    @AfterEach
    void tearDown() {
        if (apiServer != null) {
            apiServer.stop();
        }
        if (prometheus != null) {
            prometheus.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private KubernetesCapabilityDetector detector(String prometheusUrl) {
        lenient().when(prometheusConfig.url()).thenReturn(Optional.ofNullable(prometheusUrl));
        return new KubernetesCapabilityDetector(
                new KubernetesApiClient(vertx, kubernetesConfig, collectionConfig),
                vertx,
                collectorsConfig,
                collectionConfig);
    }

    private void stubNodes(String body) {
        apiServer.stubFor(get(urlPathEqualTo("/api/v1/nodes")).willReturn(aResponse().withStatus(200).withBody(body)));
    }

    private static JsonObject nodeList(JsonObject... nodes) {
        var items = new JsonArray();
        for (var node : nodes) {
            items.add(node);
        }
        return new JsonObject().put("items", items);
    }

    private static JsonObject node(String name, String providerId) {
        var spec = new JsonObject();
        if (providerId != null) {
            spec.put("providerID", providerId);
        }
        return new JsonObject().put("metadata", new JsonObject().put("name", name)).put("spec", spec);
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("should detect every backend that answers")
        void shouldDetectAllBackends() {
            apiServer.stubFor(get(urlPathEqualTo("/apis/metrics.k8s.io/v1beta1"))
                    .willReturn(aResponse().withStatus(200).withBody("{}")));
            prometheus.stubFor(get(urlPathEqualTo("/-/ready")).willReturn(aResponse().withStatus(200)));
            stubNodes(nodeList(node("ip-10-0-1-2.ec2.internal", "aws:///us-east-1a/i-0abc")).encode());

            var capabilities = detector(prometheus.baseUrl()).detect("prod").await().atMost(AWAIT);

            assertTrue(capabilities.hasMetricsAggregator());
            assertTrue(capabilities.hasQueryEngine());
            assertEquals(CloudProviderKind.AWS, capabilities.cloudProvider());
        }

        @Test
        @DisplayName("should treat failing probes as absent backends")
        void shouldTreatFailingProbesAsAbsent() {
            apiServer.stubFor(get(urlPathEqualTo("/apis/metrics.k8s.io/v1beta1"))
                    .willReturn(aResponse().withStatus(404)));
            prometheus.stubFor(get(urlPathEqualTo("/-/ready")).willReturn(aResponse().withStatus(503)));
            stubNodes(nodeList(node("worker-1", null)).encode());

            var capabilities = detector(prometheus.baseUrl()).detect("prod").await().atMost(AWAIT);

            assertFalse(capabilities.hasMetricsAggregator());
            assertFalse(capabilities.hasQueryEngine());
            assertEquals(CloudProviderKind.NONE, capabilities.cloudProvider());
        }

        @Test
        @DisplayName("should not probe a query engine that is not configured")
        void shouldSkipUnconfiguredQueryEngine() {
            apiServer.stubFor(get(urlPathEqualTo("/apis/metrics.k8s.io/v1beta1"))
                    .willReturn(aResponse().withStatus(200).withBody("{}")));
            stubNodes(nodeList().encode());

            var capabilities = detector(null).detect("prod").await().atMost(AWAIT);

            assertFalse(capabilities.hasQueryEngine());
            assertEquals(0, prometheus.getAllServeEvents().size());
        }

        @Test
        @DisplayName("should fail when the API server cannot list nodes")
        void shouldFailWithoutNodeList() {
            apiServer.stubFor(get(urlPathEqualTo("/apis/metrics.k8s.io/v1beta1"))
                    .willReturn(aResponse().withStatus(200).withBody("{}")));
            apiServer.stubFor(get(urlPathEqualTo("/api/v1/nodes")).willReturn(aResponse().withStatus(500)));

            assertThrows(KubernetesApiException.class, () -> detector(null).detect("prod").await().atMost(AWAIT));
        }
    }

    @Nested
    @DisplayName("Cloud provider")
    class CloudProvider {

        @Test
        @DisplayName("should prefer provider ids over node names")
        void shouldPreferProviderId() {
            var nodes = nodeList(node("gke-pool-1-abc", null), node("worker-2", "azure:///subscriptions/x/vm-2"));

            assertEquals(CloudProviderKind.AZURE, KubernetesCapabilityDetector.cloudProvider(nodes));
        }

        @Test
        @DisplayName("should fall back to managed node naming")
        void shouldFallBackToNodeName() {
            var nodes = nodeList(node("worker-1", null), node("gke-pool-1-abc", null));

            assertEquals(CloudProviderKind.GCP, KubernetesCapabilityDetector.cloudProvider(nodes));
        }

        @Test
        @DisplayName("should report no provider for an empty list")
        void shouldReportNoneForEmptyList() {
            assertEquals(CloudProviderKind.NONE, KubernetesCapabilityDetector.cloudProvider(new JsonObject()));
        }
    }
}
