package com.forumapi.domain.user;

import com.forumapi.commons.exceptions.ValidationException;
import com.forumapi.commons.exceptions.ValidationException.Kind;
import com.forumapi.domain.Payload;

import java.util.Map;
import java.util.regex.Pattern;

public record RegisterUser(String username, String password, String fullname) {

    static final String ENTITY = "REGISTER_USER";
    private static final int USERNAME_MAX_LENGTH = 50;
    private static final Pattern USERNAME_PATTERN = Pattern.compile("^\\w+$");

    public static RegisterUser from(Map<String, ?> raw) {
        Payload payload = Payload.of(ENTITY, raw).requireStrings("username", "password", "fullname");
        String username = payload.string("username");
        if (username.length() > USERNAME_MAX_LENGTH) {
            throw new ValidationException(ENTITY, Kind.USERNAME_LIMIT_CHAR, "username");
        }
        if (!USERNAME_PATTERN.matcher(username).matches()) {
            throw new ValidationException(ENTITY, Kind.USERNAME_CONTAIN_RESTRICTED_CHARACTER, "username");
        }
        return new RegisterUser(username, payload.string("password"), payload.string("fullname"));
    }

    /**
     * Same user with the plain password replaced by its hash, ready to be stored.
     */
    public RegisterUser withPassword(String hashedPassword) {
        return new RegisterUser(username, hashedPassword, fullname);
    }
}
