package com.forumapi.application.usecase;

import com.forumapi.application.security.PasswordHash;
import com.forumapi.domain.user.RegisterUser;
import com.forumapi.domain.user.RegisteredUser;
import com.forumapi.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class AddUserUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(AddUserUseCase.class);

    private final UserRepository userRepository;
    private final PasswordHash passwordHash;

    public AddUserUseCase(UserRepository userRepository, PasswordHash passwordHash) {
        this.userRepository = userRepository;
        this.passwordHash = passwordHash;
    }

    public RegisteredUser execute(Map<String, ?> payload) {
        RegisterUser registerUser = RegisterUser.from(payload);
        userRepository.verifyAvailableUsername(registerUser.username());
        String hashed = passwordHash.hash(registerUser.password());

        RegisteredUser registered = userRepository.addUser(registerUser.withPassword(hashed));
        LOG.info("User registered: id={}, username={}", registered.id(), registered.username());
        return registered;
    }
}
