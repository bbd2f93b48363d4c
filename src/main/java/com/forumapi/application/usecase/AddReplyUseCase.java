package com.forumapi.application.usecase;

import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.reply.AddedReply;
import com.forumapi.domain.reply.NewReply;
import com.forumapi.domain.reply.ReplyRepository;
import com.forumapi.domain.thread.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class AddReplyUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(AddReplyUseCase.class);

    private final ThreadRepository threadRepository;
    private final CommentRepository commentRepository;
    private final ReplyRepository replyRepository;

    public AddReplyUseCase(ThreadRepository threadRepository,
                           CommentRepository commentRepository,
                           ReplyRepository replyRepository) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
        this.replyRepository = replyRepository;
    }

    public AddedReply execute(Map<String, ?> payload) {
        NewReply newReply = NewReply.from(payload);
        threadRepository.verifyThreadExists(newReply.threadId());
        commentRepository.verifyCommentExists(newReply.commentId(), newReply.threadId());

        AddedReply added = replyRepository.addReply(newReply);
        LOG.info("Reply added: id={}, comment={}", added.id(), newReply.commentId());
        return added;
    }
}
