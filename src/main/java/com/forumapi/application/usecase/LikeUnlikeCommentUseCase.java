package com.forumapi.application.usecase;

import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.like.CommentLike;
import com.forumapi.domain.like.CommentLikeRepository;
import com.forumapi.domain.thread.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Toggles the caller's like on a comment: likes it if not yet liked, removes the like otherwise.
 */
public final class LikeUnlikeCommentUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(LikeUnlikeCommentUseCase.class);

    private final ThreadRepository threadRepository;
    private final CommentRepository commentRepository;
    private final CommentLikeRepository commentLikeRepository;

    public LikeUnlikeCommentUseCase(ThreadRepository threadRepository,
                                    CommentRepository commentRepository,
                                    CommentLikeRepository commentLikeRepository) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
        this.commentLikeRepository = commentLikeRepository;
    }

    public void execute(Map<String, ?> payload) {
        CommentLike like = CommentLike.from(payload);
        threadRepository.verifyThreadExists(like.threadId());
        commentRepository.verifyCommentExists(like.commentId(), like.threadId());

        if (commentLikeRepository.isLiked(like.commentId(), like.owner())) {
            commentLikeRepository.deleteLike(like.commentId(), like.owner());
            LOG.info("Comment unliked: comment={}, user={}", like.commentId(), like.owner());
        } else {
            commentLikeRepository.addLike(like);
            LOG.info("Comment liked: comment={}, user={}", like.commentId(), like.owner());
        }
    }
}
