package com.forumapi.domain.reply;

import java.time.Instant;

public record DetailReply(String id, String content, Instant date, String username) {

    public static final String DELETED_CONTENT = "**reply has been deleted**";

    public static DetailReply of(Reply reply) {
        return new DetailReply(reply.id(), reply.deleted() ? DELETED_CONTENT : reply.content(), reply.date(),
                reply.username());
    }
}
