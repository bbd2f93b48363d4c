package com.forumapi.commons.exceptions;

public class InvariantException extends ClientException {

    public InvariantException(String message) {
        super(message, 400);
    }
}
