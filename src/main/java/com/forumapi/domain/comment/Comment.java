package com.forumapi.domain.comment;

import java.time.Instant;

/**
 * A stored comment joined with its owner's username. Soft-deleted comments are still returned.
 */
public record Comment(String id, String threadId, String username, String content, Instant date, boolean deleted) {
}
