package com.forumapi.application.security;

public interface PasswordHash {

    String hash(String password);

    /**
     * @throws com.forumapi.commons.exceptions.AuthenticationException if the password does not match
     */
    void comparePassword(String password, String hashedPassword);
}
