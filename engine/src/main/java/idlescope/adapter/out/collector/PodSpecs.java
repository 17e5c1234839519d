package idlescope.adapter.out.collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import idlescope.core.model.collect.MetricsSnapshot;
import idlescope.core.model.collect.PodPlacement;
import idlescope.core.util.ResourceQuantity;

/**
 * Reads resource requests, limits and placement from Pod JSON.
 */
final class PodSpecs {

    private static final Set<String> TERMINAL_PHASES = Set.of("Succeeded", "Failed");
    private static final String DEFAULT_CONTAINER_ANNOTATION = "kubectl.kubernetes.io/default-container";

    private PodSpecs() {
        // Utility class
    }

    static String name(JsonObject pod) {
        return object(pod, "metadata").getString("name", "");
    }

    static String nodeName(JsonObject pod) {
        return object(pod, "spec").getString("nodeName", "");
    }

    static boolean isActive(JsonObject pod) {
        return !TERMINAL_PHASES.contains(object(pod, "status").getString("phase", ""));
    }

    /**
     * The container whose logs carry the pod's traffic: the one named by the
     * {@code kubectl.kubernetes.io/default-container} annotation, else the
     * first declaring container ports, else the first.
     */
    static Optional<String> servingContainer(JsonObject pod) {
        var containers = containers(pod);
        if (containers.isEmpty()) {
            return Optional.empty();
        }
        var annotated = object(object(pod, "metadata"), "annotations").getString(DEFAULT_CONTAINER_ANNOTATION);
        if (annotated != null
                && containers.stream().anyMatch(c -> annotated.equals(c.getString("name")))) {
            return Optional.of(annotated);
        }
        return containers.stream()
                .filter(c -> {
                    var ports = c.getJsonArray("ports");
                    return ports != null && !ports.isEmpty();
                })
                .findFirst()
                .or(() -> Optional.of(containers.get(0)))
                .map(c -> c.getString("name"));
    }

    static PodPlacement placement(JsonObject pod) {
        return new PodPlacement(
                name(pod),
                nodeName(pod),
                sumRequests(pod, "cpu", ResourceQuantity::cpuCores, 0.0, Double::sum),
                sumRequests(pod, "memory", ResourceQuantity::bytes, 0L, Long::sum));
    }

    /**
     * Requests, limits and placements of a set of pods.
     *
     * <p>A limit is only reported when every container of every pod declares
     * one; otherwise the workload is unbounded for that resource.
     */
    static MetricsSnapshot.Builder snapshot(List<JsonObject> pods) {
        var placements = pods.stream().map(PodSpecs::placement).toList();
        var nodes = placements.stream()
                .filter(PodPlacement::isScheduled)
                .map(PodPlacement::nodeName)
                .distinct()
                .toList();
        return MetricsSnapshot.builder()
                .cpuRequestCores(placements.stream().mapToDouble(PodPlacement::cpuRequestCores).sum())
                .memoryRequestBytes(placements.stream().mapToLong(PodPlacement::memoryRequestBytes).sum())
                .cpuLimitCores(totalLimit(pods, "cpu", ResourceQuantity::cpuCores, 0.0, Double::sum))
                .memoryLimitBytes(totalLimit(pods, "memory", ResourceQuantity::bytes, 0L, Long::sum))
                .nodeName(nodes.size() == 1 ? nodes.get(0) : null)
                .placements(placements);
    }

    static List<JsonObject> items(JsonObject list) {
        var items = list.getJsonArray("items");
        return items == null ? List.of() : objects(items);
    }

    static List<JsonObject> objects(JsonArray array) {
        var result = new ArrayList<JsonObject>();
        for (var i = 0; i < array.size(); i++) {
            var value = array.getValue(i);
            if (value instanceof JsonObject object) {
                result.add(object);
            }
        }
        return result;
    }

    static JsonObject object(JsonObject parent, String key) {
        var child = parent == null ? null : parent.getJsonObject(key);
        return child == null ? new JsonObject() : child;
    }

    private static List<JsonObject> containers(JsonObject pod) {
        var containers = object(pod, "spec").getJsonArray("containers");
        return containers == null ? List.of() : objects(containers);
    }

    private static <T> T sumRequests(
            JsonObject pod, String resource, Function<String, T> parser, T zero, BinaryOperator<T> sum) {
        var total = zero;
        for (var container : containers(pod)) {
            var quantity = object(object(container, "resources"), "requests").getString(resource);
            if (quantity != null) {
                total = sum.apply(total, parser.apply(quantity));
            }
        }
        return total;
    }

    private static <T> T totalLimit(
            List<JsonObject> pods,
            String resource,
            Function<String, T> parser,
            T zero,
            BinaryOperator<T> sum) {
        if (pods.isEmpty()) {
            return null;
        }
        var total = zero;
        for (var pod : pods) {
            for (var container : containers(pod)) {
                var quantity = object(object(container, "resources"), "limits").getString(resource);
                if (quantity == null) {
                    return null;
                }
                total = sum.apply(total, parser.apply(quantity));
            }
        }
        return total;
    }
}
