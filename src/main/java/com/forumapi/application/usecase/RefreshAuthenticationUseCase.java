package com.forumapi.application.usecase;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.domain.auth.AuthenticationRepository;
import com.forumapi.domain.auth.RefreshToken;

import java.util.Map;

/**
 * Issues a new access token for a refresh token that is both correctly signed and still stored.
 */
public final class RefreshAuthenticationUseCase {

    private final AuthenticationRepository authenticationRepository;
    private final AuthenticationTokenManager tokenManager;

    public RefreshAuthenticationUseCase(AuthenticationRepository authenticationRepository,
                                        AuthenticationTokenManager tokenManager) {
        this.authenticationRepository = authenticationRepository;
        this.tokenManager = tokenManager;
    }

    public String execute(Map<String, ?> payload) {
        String refreshToken = RefreshToken.from(payload).refreshToken();

        tokenManager.verifyRefreshToken(refreshToken);
        authenticationRepository.checkAvailabilityToken(refreshToken);

        TokenPayload identity = tokenManager.decodePayload(refreshToken);
        return tokenManager.createAccessToken(identity);
    }
}
