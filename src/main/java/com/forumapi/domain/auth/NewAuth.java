package com.forumapi.domain.auth;

public record NewAuth(String accessToken, String refreshToken) {
}
