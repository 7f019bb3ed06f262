package org.tushareplus.rest.exception;

/**
 * The server answered, but with a non-zero application status code.
 */
public class ApplicationException extends ClientException {

    private final int code;

    public ApplicationException(String endpoint, int code, String message) {
        super(endpoint, "Error " + code + ": " + message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
