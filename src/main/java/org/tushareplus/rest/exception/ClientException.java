package org.tushareplus.rest.exception;

/**
 * Root of all errors raised by the data client.
 * <p>
 * Every failure carries the endpoint it happened on, so that messages surfaced to callers always name
 * the endpoint together with the final underlying message.
 * </p>
 */
public class ClientException extends RuntimeException {

    /** Endpoint the failed operation was addressed to; may be null for endpoint-independent errors. */
    private final String endpoint;

    /**
     * Constructs a new ClientException with a message.
     *
     * @param endpoint Endpoint name, or null.
     * @param message  Human-readable error message.
     */
    public ClientException(String endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    /**
     * Constructs a new ClientException with a message and cause.
     *
     * @param endpoint Endpoint name, or null.
     * @param message  Human-readable error message.
     * @param cause    The underlying cause.
     */
    public ClientException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
