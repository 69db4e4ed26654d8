package net.deckadvisor.exception;

/**
 * Catalog request could not complete (connection refused, timeout, 5xx, unreadable payload).
 * RETRYABLE: Yes for timeouts and 5xx, no for other 4xx responses.
 */
public class CatalogTransportException extends RuntimeException {
    private final String operation;
    private final String target;
    private final boolean retryable;

    public CatalogTransportException(String operation, String target, boolean retryable, Throwable cause) {
        super("Catalog " + operation + " failed for '" + target + "'", cause);
        this.operation = operation;
        this.target = target;
        this.retryable = retryable;
    }

    public CatalogTransportException(String operation, String target, Throwable cause) {
        this(operation, target, true, cause);
    }

    public String getOperation() {
        return operation;
    }

    public String getTarget() {
        return target;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
