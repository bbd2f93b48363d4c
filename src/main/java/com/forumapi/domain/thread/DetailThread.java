package com.forumapi.domain.thread;

import com.forumapi.domain.comment.DetailComment;

import java.time.Instant;
import java.util.List;

public record DetailThread(String id, String title, String body, Instant date, String username,
                           List<DetailComment> comments) {

    public static DetailThread of(ForumThread thread, List<DetailComment> comments) {
        return new DetailThread(thread.id(), thread.title(), thread.body(), thread.date(), thread.username(),
                List.copyOf(comments));
    }
}
