package org.tushareplus.rest.exception;

/**
 * Unexpected error while discovering an endpoint's limits that is not covered by a default value,
 * e.g. a non rate-limit error during the rate calibration burst.
 */
public class ProbeFailedException extends ClientException {

    public ProbeFailedException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
    }

    public static ProbeFailedException buildProbeFailedException(String endpoint, Throwable cause) {
        return new ProbeFailedException(endpoint,
                "Limit detection for " + endpoint + " failed: " + cause.getMessage(), cause);
    }
}
