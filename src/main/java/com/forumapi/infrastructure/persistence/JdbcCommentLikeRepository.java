package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.InvariantException;
import com.forumapi.domain.like.CommentLike;
import com.forumapi.domain.like.CommentLikeRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

public final class JdbcCommentLikeRepository extends JdbcRepository implements CommentLikeRepository {

    private static final String UNIQUE_VIOLATION = "23505";

    public JdbcCommentLikeRepository(DataSource ds, SqlLoader sql, IdGenerator ids, Clock clock) {
        super(ds, sql, ids, clock);
    }

    @Override
    public boolean isLiked(String commentId, String owner) {
        return exists(sql.likeExists, commentId, owner);
    }

    @Override
    public void addLike(CommentLike like) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, sql.addLike, ids.next("like"), like.commentId(), like.owner(), now())) {
            ps.executeUpdate();
        } catch (SQLException e) {
            // a concurrent toggle by the same user won the race
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new InvariantException("comment is already liked");
            }
            throw new DataAccessException("Failed to like comment " + like.commentId(), e);
        }
    }

    @Override
    public void deleteLike(String commentId, String owner) {
        update(sql.deleteLike, commentId, owner);
    }

    @Override
    public Map<String, Integer> getLikeCountsByThreadId(String threadId) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, sql.countLikesByThread, threadId);
             ResultSet rs = ps.executeQuery()) {
            var counts = new HashMap<String, Integer>();
            while (rs.next()) {
                counts.put(rs.getString("comment_id"), rs.getInt("like_count"));
            }
            return counts;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to count likes of thread " + threadId, e);
        }
    }
}
