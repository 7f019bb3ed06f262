package org.tushareplus.model;

import lombok.Data;

/**
 * Decoded response envelope: application status code, message and the page payload.
 * A code of 0 means success; {@code data} may be null on failure.
 */
@Data
public class TransportResponse {

    private final int code;
    private final String message;
    private final PageResult data;

    public static TransportResponse success(PageResult data) {
        return new TransportResponse(0, "", data);
    }

    public static TransportResponse failure(int code, String message) {
        return new TransportResponse(code, message, null);
    }

    public boolean isSuccess() {
        return code == 0;
    }

    /** Error text in the form the server's clients conventionally report it. */
    public String describeError() {
        return "Error " + code + ": " + message;
    }
}
