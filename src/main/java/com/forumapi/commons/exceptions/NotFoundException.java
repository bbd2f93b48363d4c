package com.forumapi.commons.exceptions;

public class NotFoundException extends ClientException {

    public NotFoundException(String message) {
        super(message, 404);
    }
}
