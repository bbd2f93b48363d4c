package com.forumapi.application.usecase;

import com.forumapi.domain.comment.Comment;
import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.comment.DetailComment;
import com.forumapi.domain.like.CommentLikeRepository;
import com.forumapi.domain.reply.DetailReply;
import com.forumapi.domain.reply.Reply;
import com.forumapi.domain.reply.ReplyRepository;
import com.forumapi.domain.thread.DetailThread;
import com.forumapi.domain.thread.ForumThread;
import com.forumapi.domain.thread.ThreadRepository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a thread with its comments, their replies and like counts. Deleted comments and
 * replies keep their place in the tree with masked content.
 */
public final class GetThreadDetailUseCase {

    private final ThreadRepository threadRepository;
    private final CommentRepository commentRepository;
    private final ReplyRepository replyRepository;
    private final CommentLikeRepository commentLikeRepository;

    public GetThreadDetailUseCase(ThreadRepository threadRepository,
                                  CommentRepository commentRepository,
                                  ReplyRepository replyRepository,
                                  CommentLikeRepository commentLikeRepository) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
        this.replyRepository = replyRepository;
        this.commentLikeRepository = commentLikeRepository;
    }

    public DetailThread execute(String threadId) {
        ForumThread thread = threadRepository.getThreadById(threadId);
        List<Comment> comments = commentRepository.getCommentsByThreadId(threadId);
        List<Reply> replies = replyRepository.getRepliesByThreadId(threadId);
        Map<String, Integer> likeCounts = commentLikeRepository.getLikeCountsByThreadId(threadId);

        Map<String, List<DetailReply>> repliesByComment = new HashMap<>();
        for (Reply reply : replies) {
            repliesByComment.computeIfAbsent(reply.commentId(), k -> new ArrayList<>()).add(DetailReply.of(reply));
        }

        var detailComments = new ArrayList<DetailComment>(comments.size());
        for (Comment comment : comments) {
            detailComments.add(DetailComment.of(
                    comment,
                    repliesByComment.getOrDefault(comment.id(), List.of()),
                    likeCounts.getOrDefault(comment.id(), 0)));
        }
        return DetailThread.of(thread, detailComments);
    }
}
