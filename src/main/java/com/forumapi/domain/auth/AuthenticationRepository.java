package com.forumapi.domain.auth;

/**
 * Stores the refresh tokens that are currently valid. Logging out removes the token.
 */
public interface AuthenticationRepository {

    void addToken(String token);

    /**
     * @throws com.forumapi.commons.exceptions.InvariantException if the token is not stored
     */
    void checkAvailabilityToken(String token);

    void deleteToken(String token);
}
