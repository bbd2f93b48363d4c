package com.forumapi.domain.reply;

import java.util.List;

public interface ReplyRepository {

    AddedReply addReply(NewReply newReply);

    /**
     * @throws com.forumapi.commons.exceptions.NotFoundException if the reply does not exist under the comment
     */
    void verifyReplyExists(String replyId, String commentId);

    /**
     * @throws com.forumapi.commons.exceptions.AuthorizationException if {@code owner} did not write the reply
     */
    void verifyReplyOwner(String replyId, String owner);

    void deleteReply(String replyId);

    /**
     * Replies to every comment of the thread, deleted ones included, oldest first.
     */
    List<Reply> getRepliesByThreadId(String threadId);
}
