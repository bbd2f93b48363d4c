package com.forumapi.application.usecase;

import com.forumapi.domain.comment.AddedComment;
import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.comment.NewComment;
import com.forumapi.domain.thread.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class AddCommentUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(AddCommentUseCase.class);

    private final ThreadRepository threadRepository;
    private final CommentRepository commentRepository;

    public AddCommentUseCase(ThreadRepository threadRepository, CommentRepository commentRepository) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
    }

    public AddedComment execute(Map<String, ?> payload) {
        NewComment newComment = NewComment.from(payload);
        threadRepository.verifyThreadExists(newComment.threadId());

        AddedComment added = commentRepository.addComment(newComment);
        LOG.info("Comment added: id={}, thread={}", added.id(), newComment.threadId());
        return added;
    }
}
