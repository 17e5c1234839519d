package idlescope.core.model.activity;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only summary of classified traffic over one window.
 *
 * <p>{@code businessRatio = businessRequests / max(totalRequests, 1)}, so a
 * window without requests has ratio 0.
 *
 * @param totalRequests     all extracted requests
 * @param businessRequests  requests not excluded by any rule
 * @param businessRatio     ratio in [0, 1]
 * @param pathHistogram     counts per (method, path), sorted by path then method
 * @param exclusionsByRule  excluded request count per rule name, sorted by name
 */
public record BusinessActivity(
        long totalRequests,
        long businessRequests,
        double businessRatio,
        SortedMap<RequestKey, PathActivity> pathHistogram,
        SortedMap<String, Long> exclusionsByRule) {

    public BusinessActivity {
        pathHistogram = Collections.unmodifiableSortedMap(
                new TreeMap<>(pathHistogram == null ? Map.of() : pathHistogram));
        exclusionsByRule = Collections.unmodifiableSortedMap(
                new TreeMap<>(exclusionsByRule == null ? Map.of() : exclusionsByRule));
    }

    public static BusinessActivity empty() {
        return new BusinessActivity(0, 0, 0.0, null, null);
    }

    public static double ratio(long businessRequests, long totalRequests) {
        return (double) businessRequests / Math.max(totalRequests, 1);
    }

    public boolean hasTraffic() {
        return totalRequests > 0;
    }

    /**
     * Incremental builder used by the classifier.
     */
    public static final class Accumulator {
        private final TreeMap<RequestKey, PathActivity> histogram = new TreeMap<>();
        private final TreeMap<String, Long> exclusions = new TreeMap<>();
        private long total;
        private long business;

        public void business(RequestRecord record) {
            total++;
            business++;
            histogram.merge(record.key(), new PathActivity(1, 1), (a, b) -> a.add(true));
        }

        public void excluded(RequestRecord record, String ruleName) {
            total++;
            histogram.merge(record.key(), new PathActivity(1, 0), (a, b) -> a.add(false));
            exclusions.merge(ruleName, 1L, Long::sum);
        }

        public BusinessActivity build() {
            return new BusinessActivity(total, business, ratio(business, total), histogram, exclusions);
        }
    }
}
