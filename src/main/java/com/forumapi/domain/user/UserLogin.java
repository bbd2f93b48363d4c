package com.forumapi.domain.user;

import com.forumapi.domain.Payload;

import java.util.Map;

public record UserLogin(String username, String password) {

    public static UserLogin from(Map<String, ?> raw) {
        Payload payload = Payload.of("USER_LOGIN", raw).requireStrings("username", "password");
        return new UserLogin(payload.string("username"), payload.string("password"));
    }
}
