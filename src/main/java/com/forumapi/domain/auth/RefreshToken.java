package com.forumapi.domain.auth;

import com.forumapi.domain.Payload;

import java.util.Map;

public record RefreshToken(String refreshToken) {

    public static RefreshToken from(Map<String, ?> raw) {
        return new RefreshToken(Payload.of("REFRESH_TOKEN", raw).requireStrings("refreshToken").string("refreshToken"));
    }
}
