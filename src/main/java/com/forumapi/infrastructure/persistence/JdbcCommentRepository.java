package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.AuthorizationException;
import com.forumapi.commons.exceptions.NotFoundException;
import com.forumapi.domain.comment.AddedComment;
import com.forumapi.domain.comment.Comment;
import com.forumapi.domain.comment.CommentRepository;
import com.forumapi.domain.comment.NewComment;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public final class JdbcCommentRepository extends JdbcRepository implements CommentRepository {

    public JdbcCommentRepository(DataSource ds, SqlLoader sql, IdGenerator ids, Clock clock) {
        super(ds, sql, ids, clock);
    }

    @Override
    public AddedComment addComment(NewComment newComment) {
        String id = ids.next("comment");
        update(sql.addComment, id, newComment.threadId(), newComment.owner(), newComment.content(), now());
        return new AddedComment(id, newComment.content(), newComment.owner());
    }

    @Override
    public void verifyCommentExists(String commentId, String threadId) {
        if (!exists(sql.commentExists, commentId, threadId)) {
            throw new NotFoundException("comment not found");
        }
    }

    @Override
    public void verifyCommentOwner(String commentId, String owner) {
        String actual = queryString(sql.getCommentOwner, "owner", commentId);
        if (actual == null) {
            throw new NotFoundException("comment not found");
        }
        if (!actual.equals(owner)) {
            throw new AuthorizationException("you are not the owner of this comment");
        }
    }

    @Override
    public void deleteComment(String commentId) {
        if (update(sql.deleteComment, commentId) != 1) {
            throw new NotFoundException("comment not found");
        }
    }

    @Override
    public List<Comment> getCommentsByThreadId(String threadId) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, sql.listCommentsByThread, threadId);
             ResultSet rs = ps.executeQuery()) {
            var list = new ArrayList<Comment>();
            while (rs.next()) {
                list.add(new Comment(
                        rs.getString("id"),
                        rs.getString("thread_id"),
                        rs.getString("username"),
                        rs.getString("content"),
                        rs.getTimestamp("created_at").toInstant(),
                        rs.getBoolean("is_delete")));
            }
            return list;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to list comments of thread " + threadId, e);
        }
    }
}
