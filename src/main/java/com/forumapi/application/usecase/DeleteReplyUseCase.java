package com.forumapi.application.usecase;

import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.reply.DeleteReply;
import com.forumapi.domain.reply.ReplyRepository;
import com.forumapi.domain.thread.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class DeleteReplyUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(DeleteReplyUseCase.class);

    private final ThreadRepository threadRepository;
    private final CommentRepository commentRepository;
    private final ReplyRepository replyRepository;

    public DeleteReplyUseCase(ThreadRepository threadRepository,
                              CommentRepository commentRepository,
                              ReplyRepository replyRepository) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
        this.replyRepository = replyRepository;
    }

    public void execute(Map<String, ?> payload) {
        DeleteReply command = DeleteReply.from(payload);
        threadRepository.verifyThreadExists(command.threadId());
        commentRepository.verifyCommentExists(command.commentId(), command.threadId());
        replyRepository.verifyReplyExists(command.replyId(), command.commentId());
        replyRepository.verifyReplyOwner(command.replyId(), command.owner());

        replyRepository.deleteReply(command.replyId());
        LOG.info("Reply deleted: id={}, owner={}", command.replyId(), command.owner());
    }
}
