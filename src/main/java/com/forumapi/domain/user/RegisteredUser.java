package com.forumapi.domain.user;

public record RegisteredUser(String id, String username, String fullname) {
}
