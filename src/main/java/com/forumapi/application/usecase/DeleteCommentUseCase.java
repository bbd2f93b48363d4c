package com.forumapi.application.usecase;

import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.comment.DeleteComment;
import com.forumapi.domain.thread.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class DeleteCommentUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(DeleteCommentUseCase.class);

    private final ThreadRepository threadRepository;
    private final CommentRepository commentRepository;

    public DeleteCommentUseCase(ThreadRepository threadRepository, CommentRepository commentRepository) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
    }

    public void execute(Map<String, ?> payload) {
        DeleteComment command = DeleteComment.from(payload);
        threadRepository.verifyThreadExists(command.threadId());
        commentRepository.verifyCommentExists(command.commentId(), command.threadId());
        commentRepository.verifyCommentOwner(command.commentId(), command.owner());

        commentRepository.deleteComment(command.commentId());
        LOG.info("Comment deleted: id={}, owner={}", command.commentId(), command.owner());
    }
}
