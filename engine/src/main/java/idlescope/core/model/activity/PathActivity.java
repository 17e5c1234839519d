package idlescope.core.model.activity;

/**
 * Request counts for one histogram bucket.
 *
 * @param total    every request seen for the key
 * @param business requests classified as business traffic
 */
public record PathActivity(long total, long business) {

    public long noise() {
        return total - business;
    }

    PathActivity add(boolean isBusiness) {
        return new PathActivity(total + 1, isBusiness ? business + 1 : business);
    }
}
