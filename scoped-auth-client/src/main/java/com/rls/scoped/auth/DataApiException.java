package com.rls.scoped.auth;

import lombok.Getter;

/**
 * The data API answered with a non-2xx status, or could not be reached ({@code statusCode} is -1 then).
 */
@Getter
public class DataApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String body;

    public DataApiException(int statusCode, String body) {
        super("Data API call failed: HTTP " + statusCode + " - " + body);
        this.statusCode = statusCode;
        this.body = body;
    }

    public DataApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.body = null;
    }
}
