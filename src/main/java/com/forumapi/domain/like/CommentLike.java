package com.forumapi.domain.like;

import com.forumapi.domain.Payload;

import java.util.Map;

public record CommentLike(String threadId, String commentId, String owner) {

    public static CommentLike from(Map<String, ?> raw) {
        Payload payload = Payload.of("COMMENT_LIKE", raw).requireStrings("threadId", "commentId", "owner");
        return new CommentLike(payload.string("threadId"), payload.string("commentId"), payload.string("owner"));
    }
}
