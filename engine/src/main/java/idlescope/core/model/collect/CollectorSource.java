package idlescope.core.model.collect;

/**
 * Telemetry source kinds, declared in merge priority order.
 *
 * <p>When merging, a source later in this order overwrites the fields it
 * provides; fields it lacks keep the earlier source's value.
 */
public enum CollectorSource {
    CORE_API("core-api"),
    AGGREGATOR("metrics-aggregator"),
    QUERY_ENGINE("query-engine"),
    NODE_AGENT("node-agent"),
    CLOUD_TELEMETRY("cloud-telemetry");

    private final String tag;

    CollectorSource(String tag) {
        this.tag = tag;
    }

    /**
     * Provenance tag used in merged records, logs and metrics.
     */
    public String tag() {
        return tag;
    }

    public int priority() {
        return ordinal();
    }
}
