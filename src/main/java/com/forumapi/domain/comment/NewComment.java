package com.forumapi.domain.comment;

import com.forumapi.domain.Payload;

import java.util.Map;

public record NewComment(String content, String threadId, String owner) {

    public static NewComment from(Map<String, ?> raw) {
        Payload payload = Payload.of("NEW_COMMENT", raw).requireStrings("content", "threadId", "owner");
        return new NewComment(payload.string("content"), payload.string("threadId"), payload.string("owner"));
    }
}
