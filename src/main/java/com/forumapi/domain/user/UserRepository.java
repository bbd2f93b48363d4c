package com.forumapi.domain.user;

public interface UserRepository {

    RegisteredUser addUser(RegisterUser registerUser);

    /**
     * @throws com.forumapi.commons.exceptions.InvariantException if the username is taken
     */
    void verifyAvailableUsername(String username);

    /**
     * @throws com.forumapi.commons.exceptions.InvariantException if no such user exists
     */
    String getPasswordByUsername(String username);

    String getIdByUsername(String username);
}
