package com.forumapi.commons.exceptions;

public class AuthenticationException extends ClientException {

    public AuthenticationException(String message) {
        super(message, 401);
    }
}
