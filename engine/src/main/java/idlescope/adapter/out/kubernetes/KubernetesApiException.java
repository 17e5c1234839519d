package idlescope.adapter.out.kubernetes;

/**
 * A Kubernetes API request answered with an unexpected status or body.
 */
public class KubernetesApiException extends RuntimeException {

    private final int statusCode;

    public KubernetesApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
