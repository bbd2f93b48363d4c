package com.forumapi.application.usecase;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.PasswordHash;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.domain.auth.AuthenticationRepository;
import com.forumapi.domain.auth.NewAuth;
import com.forumapi.domain.user.UserLogin;
import com.forumapi.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class LoginUserUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(LoginUserUseCase.class);

    private final UserRepository userRepository;
    private final AuthenticationRepository authenticationRepository;
    private final AuthenticationTokenManager tokenManager;
    private final PasswordHash passwordHash;

    public LoginUserUseCase(UserRepository userRepository,
                            AuthenticationRepository authenticationRepository,
                            AuthenticationTokenManager tokenManager,
                            PasswordHash passwordHash) {
        this.userRepository = userRepository;
        this.authenticationRepository = authenticationRepository;
        this.tokenManager = tokenManager;
        this.passwordHash = passwordHash;
    }

    public NewAuth execute(Map<String, ?> payload) {
        UserLogin login = UserLogin.from(payload);

        String hashed = userRepository.getPasswordByUsername(login.username());
        passwordHash.comparePassword(login.password(), hashed);

        String id = userRepository.getIdByUsername(login.username());
        TokenPayload identity = new TokenPayload(id, login.username());
        String accessToken = tokenManager.createAccessToken(identity);
        String refreshToken = tokenManager.createRefreshToken(identity);

        authenticationRepository.addToken(refreshToken);
        LOG.info("User logged in: id={}", id);
        return new NewAuth(accessToken, refreshToken);
    }
}
