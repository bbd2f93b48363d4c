package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.InvariantException;
import com.forumapi.domain.user.RegisterUser;
import com.forumapi.domain.user.RegisteredUser;
import com.forumapi.domain.user.UserRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

public final class JdbcUserRepository extends JdbcRepository implements UserRepository {

    private static final String UNIQUE_VIOLATION = "23505";

    public JdbcUserRepository(DataSource ds, SqlLoader sql, IdGenerator ids, Clock clock) {
        super(ds, sql, ids, clock);
    }

    @Override
    public RegisteredUser addUser(RegisterUser registerUser) {
        String id = ids.next("user");
        try (Connection conn = ds.getConnection();
             var ps = prepare(conn, sql.addUser, id, registerUser.username(), registerUser.password(),
                     registerUser.fullname())) {
            ps.executeUpdate();
        } catch (SQLException e) {
            // another registration took the username after the availability check
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new InvariantException("username is not available");
            }
            throw new DataAccessException("Failed to add user " + registerUser.username(), e);
        }
        return new RegisteredUser(id, registerUser.username(), registerUser.fullname());
    }

    @Override
    public void verifyAvailableUsername(String username) {
        if (exists(sql.usernameExists, username)) {
            throw new InvariantException("username is not available");
        }
    }

    @Override
    public String getPasswordByUsername(String username) {
        String password = queryString(sql.getPasswordByUsername, "password", username);
        if (password == null) {
            throw new InvariantException("username not found");
        }
        return password;
    }

    @Override
    public String getIdByUsername(String username) {
        String id = queryString(sql.getIdByUsername, "id", username);
        if (id == null) {
            throw new InvariantException("user not found");
        }
        return id;
    }
}
