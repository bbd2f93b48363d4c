package com.forumapi.domain.reply;

import java.time.Instant;

public record Reply(String id, String commentId, String username, String content, Instant date, boolean deleted) {
}
