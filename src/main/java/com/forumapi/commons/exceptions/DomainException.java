package com.forumapi.commons.exceptions;

/**
 * A business-rule violation raised by the domain layer, identified by a code such as
 * {@code REGISTER_USER.USERNAME_LIMIT_CHAR}. Translated to a client error by
 * {@link DomainErrorTranslator}.
 */
public class DomainException extends RuntimeException {

    private final String code;

    public DomainException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
