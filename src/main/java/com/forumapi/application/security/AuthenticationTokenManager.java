package com.forumapi.application.security;

public interface AuthenticationTokenManager {

    String createAccessToken(TokenPayload payload);

    String createRefreshToken(TokenPayload payload);

    /**
     * @throws com.forumapi.commons.exceptions.AuthenticationException if the token is missing its
     *         signature, expired or signed with another key
     */
    TokenPayload verifyAccessToken(String token);

    /**
     * @throws com.forumapi.commons.exceptions.InvariantException if the token is not a valid refresh token
     */
    void verifyRefreshToken(String token);

    /**
     * Reads the identity out of a refresh token that has already passed {@link #verifyRefreshToken}.
     */
    TokenPayload decodePayload(String token);
}
