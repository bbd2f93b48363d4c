package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.AuthorizationException;
import com.forumapi.commons.exceptions.NotFoundException;
import com.forumapi.domain.reply.AddedReply;
import com.forumapi.domain.reply.NewReply;
import com.forumapi.domain.reply.Reply;
import com.forumapi.domain.reply.ReplyRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public final class JdbcReplyRepository extends JdbcRepository implements ReplyRepository {

    public JdbcReplyRepository(DataSource ds, SqlLoader sql, IdGenerator ids, Clock clock) {
        super(ds, sql, ids, clock);
    }

    @Override
    public AddedReply addReply(NewReply newReply) {
        String id = ids.next("reply");
        update(sql.addReply, id, newReply.commentId(), newReply.owner(), newReply.content(), now());
        return new AddedReply(id, newReply.content(), newReply.owner());
    }

    @Override
    public void verifyReplyExists(String replyId, String commentId) {
        if (!exists(sql.replyExists, replyId, commentId)) {
            throw new NotFoundException("reply not found");
        }
    }

    @Override
    public void verifyReplyOwner(String replyId, String owner) {
        String actual = queryString(sql.getReplyOwner, "owner", replyId);
        if (actual == null) {
            throw new NotFoundException("reply not found");
        }
        if (!actual.equals(owner)) {
            throw new AuthorizationException("you are not the owner of this reply");
        }
    }

    @Override
    public void deleteReply(String replyId) {
        if (update(sql.deleteReply, replyId) != 1) {
            throw new NotFoundException("reply not found");
        }
    }

    @Override
    public List<Reply> getRepliesByThreadId(String threadId) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, sql.listRepliesByThread, threadId);
             ResultSet rs = ps.executeQuery()) {
            var list = new ArrayList<Reply>();
            while (rs.next()) {
                list.add(new Reply(
                        rs.getString("id"),
                        rs.getString("comment_id"),
                        rs.getString("username"),
                        rs.getString("content"),
                        rs.getTimestamp("created_at").toInstant(),
                        rs.getBoolean("is_delete")));
            }
            return list;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to list replies of thread " + threadId, e);
        }
    }
}
