package idlescope.core.service.activity;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One JSON object per line, as written by structured loggers and proxies.
 *
 * <p>Fields are looked up at the top level and in a nested {@code request}
 * or {@code http} object, using the same aliases as {@link KeyValueLogPattern}.
 */
public class JsonLogPattern implements LogLinePattern {

    private static final List<String> NESTED = List.of("request", "http", "httpRequest");

    private final ObjectMapper objectMapper;

    public JsonLogPattern(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public Optional<ParsedLogLine> parse(String line) {
        if (!line.startsWith("{")) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        var method = text(root, KeyValueLogPattern.METHOD_KEYS);
        var path = text(root, KeyValueLogPattern.PATH_KEYS);
        var status = text(root, KeyValueLogPattern.STATUS_KEYS).flatMap(KeyValueLogPattern::statusCode);
        if (method.isEmpty() || path.isEmpty() || status.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedLogLine(
                timestamp(root),
                method.get().toUpperCase(Locale.ROOT),
                path.get(),
                status.get(),
                text(root, KeyValueLogPattern.USER_AGENT_KEYS),
                text(root, KeyValueLogPattern.SOURCE_IP_KEYS)));
    }

    private Optional<Instant> timestamp(JsonNode root) {
        return field(root, KeyValueLogPattern.TIMESTAMP_KEYS).flatMap(node -> node.isNumber()
                ? epoch(node)
                : LogTimestamps.flexible(node.asText()));
    }

    private static Optional<Instant> epoch(JsonNode node) {
        // doubles beyond range decode to infinity
        if (node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue())) {
            return Optional.empty();
        }
        return LogTimestamps.epoch(node.decimalValue());
    }

    private static Optional<String> text(JsonNode root, List<String> keys) {
        return field(root, keys)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .filter(value -> !value.isBlank());
    }

    private static Optional<JsonNode> field(JsonNode root, List<String> keys) {
        var direct = lookup(root, keys);
        if (direct.isPresent()) {
            return direct;
        }
        for (var nested : NESTED) {
            var child = root.get(nested);
            if (child != null && child.isObject()) {
                var found = lookup(child, keys);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> lookup(JsonNode node, List<String> keys) {
        for (var key : keys) {
            var value = node.get(key);
            if (value != null && !value.isNull()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
