package com.forumapi.domain.comment;

import com.forumapi.domain.Payload;

import java.util.Map;

public record DeleteComment(String commentId, String threadId, String owner) {

    public static DeleteComment from(Map<String, ?> raw) {
        Payload payload = Payload.of("DELETE_COMMENT", raw).requireStrings("commentId", "threadId", "owner");
        return new DeleteComment(payload.string("commentId"), payload.string("threadId"), payload.string("owner"));
    }
}
