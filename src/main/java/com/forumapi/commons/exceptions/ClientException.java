package com.forumapi.commons.exceptions;

/**
 * Base for failures caused by the caller. The HTTP layer renders these as {@code fail}
 * responses with {@link #getStatusCode()}.
 */
public abstract class ClientException extends RuntimeException {

    private final int statusCode;

    protected ClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
