package com.forumapi.domain.comment;

import java.util.List;

public interface CommentRepository {

    AddedComment addComment(NewComment newComment);

    /**
     * @throws com.forumapi.commons.exceptions.NotFoundException if the comment does not exist in the thread
     */
    void verifyCommentExists(String commentId, String threadId);

    /**
     * @throws com.forumapi.commons.exceptions.AuthorizationException if {@code owner} did not write the comment
     */
    void verifyCommentOwner(String commentId, String owner);

    void deleteComment(String commentId);

    /**
     * Comments of the thread, deleted ones included, oldest first.
     */
    List<Comment> getCommentsByThreadId(String threadId);
}
