package org.tushareplus.rest.exception;

/**
 * The fetch was cancelled through its token, or the calling thread was interrupted while waiting.
 */
public class FetchCancelledException extends ClientException {

    public FetchCancelledException(String endpoint, String message) {
        super(endpoint, message);
    }

    public FetchCancelledException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
    }
}
