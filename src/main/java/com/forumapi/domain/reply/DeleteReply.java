package com.forumapi.domain.reply;

import com.forumapi.domain.Payload;

import java.util.Map;

public record DeleteReply(String replyId, String commentId, String threadId, String owner) {

    public static DeleteReply from(Map<String, ?> raw) {
        Payload payload = Payload.of("DELETE_REPLY", raw).requireStrings("replyId", "commentId", "threadId", "owner");
        return new DeleteReply(payload.string("replyId"), payload.string("commentId"), payload.string("threadId"),
                payload.string("owner"));
    }
}
