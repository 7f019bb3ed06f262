package org.tushareplus.rest.exception;

/**
 * A page request failed for good: either the error was not retryable or the retry budget is exhausted.
 * The message embeds the endpoint and the final error text; the last failure is kept as the cause.
 */
public class RequestFailedException extends ClientException {

    private final int attempts;

    public RequestFailedException(String endpoint, int attempts, ClientException lastFailure) {
        super(endpoint, "Request to " + endpoint + " failed after " + attempts + " attempt(s): "
                + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
