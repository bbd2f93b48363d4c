package com.forumapi.infrastructure.persistence;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;

/**
 * Shared plumbing for the JDBC repositories. Every call borrows a pooled connection and
 * returns it before the method exits.
 */
abstract class JdbcRepository {

    protected final DataSource ds;
    protected final SqlLoader sql;
    protected final IdGenerator ids;
    protected final Clock clock;

    /** For repositories that neither mint ids nor timestamp rows. */
    JdbcRepository(DataSource ds, SqlLoader sql) {
        this(ds, sql, null, null);
    }

    JdbcRepository(DataSource ds, SqlLoader sql, IdGenerator ids, Clock clock) {
        this.ds = ds;
        this.sql = sql;
        this.ids = ids;
        this.clock = clock;
    }

    protected boolean exists(String query, Object... params) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, query, params);
             ResultSet rs = ps.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            throw new DataAccessException("Query failed: " + query, e);
        }
    }

    protected String queryString(String query, String column, Object... params) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, query, params);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(column) : null;
        } catch (SQLException e) {
            throw new DataAccessException("Query failed: " + query, e);
        }
    }

    protected int update(String query, Object... params) {
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, query, params)) {
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new DataAccessException("Update failed: " + query, e);
        }
    }

    protected Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    static PreparedStatement prepare(Connection conn, String query, Object... params) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(query);
        try {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }
}
