package com.forumapi.commons.exceptions;

import java.util.Map;

/**
 * Maps domain exceptions onto client exceptions. Anything that is not a {@link DomainException}
 * passes through unchanged.
 */
public final class DomainErrorTranslator {

    private static final Map<String, String> ACTIONS = Map.ofEntries(
            Map.entry("REGISTER_USER", "cannot create a new user"),
            Map.entry("USER_LOGIN", "cannot log in"),
            Map.entry("REFRESH_TOKEN", "refresh token must be provided"),
            Map.entry("NEW_THREAD", "cannot create a new thread"),
            Map.entry("NEW_COMMENT", "cannot create a new comment"),
            Map.entry("DELETE_COMMENT", "cannot delete the comment"),
            Map.entry("NEW_REPLY", "cannot create a new reply"),
            Map.entry("DELETE_REPLY", "cannot delete the reply"),
            Map.entry("COMMENT_LIKE", "cannot like the comment")
    );

    private DomainErrorTranslator() {
    }

    public static Throwable translate(Throwable error) {
        if (!(error instanceof DomainException domainError)) {
            return error;
        }
        String code = domainError.getCode();
        int dot = code.indexOf('.');
        String action = ACTIONS.get(dot < 0 ? code : code.substring(0, dot));
        if (action == null) {
            return new InvariantException(domainError.getMessage());
        }
        return new InvariantException(action + ": " + domainError.getMessage());
    }
}
