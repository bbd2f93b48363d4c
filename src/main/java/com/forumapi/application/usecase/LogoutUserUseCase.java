package com.forumapi.application.usecase;

import com.forumapi.domain.auth.AuthenticationRepository;
import com.forumapi.domain.auth.RefreshToken;

import java.util.Map;

public final class LogoutUserUseCase {

    private final AuthenticationRepository authenticationRepository;

    public LogoutUserUseCase(AuthenticationRepository authenticationRepository) {
        this.authenticationRepository = authenticationRepository;
    }

    public void execute(Map<String, ?> payload) {
        String refreshToken = RefreshToken.from(payload).refreshToken();
        authenticationRepository.checkAvailabilityToken(refreshToken);
        authenticationRepository.deleteToken(refreshToken);
    }
}
