package com.forumapi.infrastructure.security;

import at.favre.lib.crypto.bcrypt.BCrypt;
import com.forumapi.application.security.PasswordHash;
import com.forumapi.commons.exceptions.AuthenticationException;

public final class BcryptPasswordHash implements PasswordHash {

    private final int cost;

    public BcryptPasswordHash() {
        this(10);
    }

    public BcryptPasswordHash(int cost) {
        this.cost = cost;
    }

    @Override
    public String hash(String password) {
        return BCrypt.withDefaults().hashToString(cost, password.toCharArray());
    }

    @Override
    public void comparePassword(String password, String hashedPassword) {
        if (!BCrypt.verifyer().verify(password.toCharArray(), hashedPassword).verified) {
            throw new AuthenticationException("wrong credentials");
        }
    }
}
