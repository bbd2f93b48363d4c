package com.forumapi.domain.comment;

import com.forumapi.domain.reply.DetailReply;

import java.time.Instant;
import java.util.List;

public record DetailComment(String id, String username, Instant date, String content, int likeCount,
                            List<DetailReply> replies) {

    public static final String DELETED_CONTENT = "**comment has been deleted**";

    public static DetailComment of(Comment comment, List<DetailReply> replies, int likeCount) {
        String content = comment.deleted() ? DELETED_CONTENT : comment.content();
        return new DetailComment(comment.id(), comment.username(), comment.date(), content, likeCount,
                List.copyOf(replies));
    }
}
