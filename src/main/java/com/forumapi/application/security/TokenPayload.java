package com.forumapi.application.security;

/**
 * Identity carried inside access and refresh tokens.
 */
public record TokenPayload(String id, String username) {
}
