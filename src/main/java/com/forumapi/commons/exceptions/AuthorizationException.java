package com.forumapi.commons.exceptions;

public class AuthorizationException extends ClientException {

    public AuthorizationException(String message) {
        super(message, 403);
    }
}
