package idlescope.adapter.out.billing;

/**
 * The billing adapter could not produce prices for a cluster.
 */
public class BillingException extends RuntimeException {

    public BillingException(String message) {
        super(message);
    }

    public BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
