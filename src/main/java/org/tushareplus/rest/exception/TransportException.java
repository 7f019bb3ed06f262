package org.tushareplus.rest.exception;

/**
 * Network or decoding failure while exchanging a request with the remote service.
 * Always considered transient by the retry policy.
 */
public class TransportException extends ClientException {

    public TransportException(String endpoint, String message) {
        super(endpoint, message);
    }

    public TransportException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
    }

    /**
     * Factory method to wrap an I/O or parsing failure.
     *
     * @param endpoint Endpoint the request was addressed to.
     * @param cause    The original throwable.
     * @return A new TransportException describing the cause.
     */
    public static TransportException buildTransportException(String endpoint, Throwable cause) {
        return new TransportException(endpoint, String.valueOf(cause.getMessage()), cause);
    }
}
