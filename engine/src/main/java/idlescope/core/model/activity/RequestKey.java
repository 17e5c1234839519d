package idlescope.core.model.activity;

import java.util.Comparator;

/**
 * Histogram key: method and query-less path.
 */
public record RequestKey(String method, String path) implements Comparable<RequestKey> {

    private static final Comparator<RequestKey> ORDER =
            Comparator.comparing(RequestKey::path).thenComparing(RequestKey::method);

    @Override
    public int compareTo(RequestKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
