package com.forumapi.domain.reply;

import com.forumapi.domain.Payload;

import java.util.Map;

public record NewReply(String content, String threadId, String commentId, String owner) {

    public static NewReply from(Map<String, ?> raw) {
        Payload payload = Payload.of("NEW_REPLY", raw).requireStrings("content", "threadId", "commentId", "owner");
        return new NewReply(payload.string("content"), payload.string("threadId"), payload.string("commentId"),
                payload.string("owner"));
    }
}
