package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.NotFoundException;
import com.forumapi.domain.thread.AddedThread;
import com.forumapi.domain.thread.ForumThread;
import com.forumapi.domain.thread.NewThread;
import com.forumapi.domain.thread.ThreadRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;

public final class JdbcThreadRepository extends JdbcRepository implements ThreadRepository {

    public JdbcThreadRepository(DataSource ds, SqlLoader sql, IdGenerator ids, Clock clock) {
        super(ds, sql, ids, clock);
    }

    @Override
    public AddedThread addThread(NewThread newThread) {
        String id = ids.next("thread");
        update(sql.addThread, id, newThread.title(), newThread.body(), newThread.owner(), now());
        return new AddedThread(id, newThread.title(), newThread.owner());
    }

    @Override
    public void verifyThreadExists(String threadId) {
        if (!exists(sql.threadExists, threadId)) {
            throw new NotFoundException("thread not found");
        }
    }

    @Override
    public ForumThread getThreadById(String threadId) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, sql.getThread, threadId);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new NotFoundException("thread not found");
            }
            return new ForumThread(
                    rs.getString("id"),
                    rs.getString("title"),
                    rs.getString("body"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getString("username"));
        } catch (SQLException e) {
            throw new DataAccessException("Failed to load thread " + threadId, e);
        }
    }
}
