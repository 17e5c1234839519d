package idlescope.adapter.out.kubernetes;

import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import idlescope.core.config.CollectionConfig;
import idlescope.core.config.KubernetesConfig;

/**
 * Minimal read-only client for the Kubernetes API server.
 *
 * <p>Shared by the core API, metrics aggregator and node agent collectors,
 * the capability detector and the billing adapter. Every request carries the
 * configured bearer token and is bounded by the collector timeout.
 */
@ApplicationScoped
public class KubernetesApiClient {

    private static final Logger LOG = Logger.getLogger(KubernetesApiClient.class);

    private final WebClient webClient;
    private final String apiUrl;
    private final Optional<String> bearerToken;
    private final long timeoutMs;

    @Inject
    public KubernetesApiClient(Vertx vertx, KubernetesConfig config, CollectionConfig collection) {
        this.webClient = WebClient.create(
                vertx, new WebClientOptions().setTrustAll(config.trustAll()).setVerifyHost(!config.trustAll()));
        this.apiUrl = stripTrailingSlash(config.apiUrl());
        this.bearerToken = config.bearerToken().filter(token -> !token.isBlank());
        this.timeoutMs = collection.collectorTimeout().toMillis();
        if (config.trustAll()) {
            LOG.warnf("TLS certificate checks disabled for Kubernetes API %s", apiUrl);
        }
    }

    public String apiUrl() {
        return apiUrl;
    }

    public Uni<JsonObject> getJson(String path) {
        return getJson(path, Map.of());
    }

    /**
     * GET a JSON resource.
     *
     * @throws KubernetesApiException (as failure) on a non-200 status or an empty body
     */
    public Uni<JsonObject> getJson(String path, Map<String, String> query) {
        return send(path, query, "application/json").map(response -> {
            expectOk(path, response);
            if (response.body() == null || response.body().length() == 0) {
                throw new KubernetesApiException(response.statusCode(), "Empty response body for " + path);
            }
            return response.bodyAsJsonObject();
        });
    }

    /**
     * GET a plain-text resource such as container logs.
     */
    public Uni<String> getText(String path, Map<String, String> query) {
        return send(path, query, "text/plain").map(response -> {
            expectOk(path, response);
            var body = response.bodyAsString();
            return body == null ? "" : body;
        });
    }

    /**
     * Status code of a GET request, without interpreting it.
     */
    public Uni<Integer> probe(String path) {
        return send(path, Map.of(), "application/json").map(HttpResponse::statusCode);
    }

    private Uni<HttpResponse<Buffer>> send(String path, Map<String, String> query, String accept) {
        var request = webClient.getAbs(apiUrl + path).timeout(timeoutMs).putHeader("Accept", accept);
        bearerToken.ifPresent(token -> request.putHeader("Authorization", "Bearer " + token));
        query.forEach(request::addQueryParam);
        LOG.tracef("GET %s%s %s", apiUrl, path, query);
        return request.send();
    }

    private static void expectOk(String path, HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.debugf("Kubernetes API %s returned %d: %s", path, response.statusCode(), response.bodyAsString());
            throw new KubernetesApiException(
                    response.statusCode(), "Kubernetes API returned status " + response.statusCode() + " for " + path);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
