package com.forumapi.domain.thread;

import java.time.Instant;

/**
 * A stored thread joined with its owner's username.
 */
public record ForumThread(String id, String title, String body, Instant date, String username) {
}
