package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.InvariantException;
import com.forumapi.domain.auth.AuthenticationRepository;

import javax.sql.DataSource;

public final class JdbcAuthenticationRepository extends JdbcRepository implements AuthenticationRepository {

    public JdbcAuthenticationRepository(DataSource ds, SqlLoader sql) {
        super(ds, sql);
    }

    @Override
    public void addToken(String token) {
        update(sql.addToken, token);
    }

    @Override
    public void checkAvailabilityToken(String token) {
        if (!exists(sql.tokenExists, token)) {
            throw new InvariantException("refresh token not found in database");
        }
    }

    @Override
    public void deleteToken(String token) {
        update(sql.deleteToken, token);
    }
}
