package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.InvariantException;
import com.forumapi.domain.user.RegisterUser;
import com.forumapi.domain.user.RegisteredUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcUserRepositoryTest {

    private TestDatabase db;
    private JdbcUserRepository repository;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        repository = new JdbcUserRepository(db.dataSource(), new SqlLoader(), prefix -> prefix + "-123",
                Clock.systemUTC());
    }

    @Test
    void addUser_shouldPersistAndReturnRegisteredUser() {
        RegisteredUser user = repository.addUser(new RegisterUser("dicoding", "hashed", "Dicoding Indonesia"));

        assertThat(user).isEqualTo(new RegisteredUser("user-123", "dicoding", "Dicoding Indonesia"));
        assertThat(db.count("users", "id = ?", "user-123")).isEqualTo(1);
    }

    @Test
    void addUser_shouldRejectUsernameTakenAfterAvailabilityCheck() {
        var sequence = new AtomicInteger();
        var racing = new JdbcUserRepository(db.dataSource(), new SqlLoader(),
                prefix -> prefix + "-" + sequence.incrementAndGet(), Clock.systemUTC());
        racing.verifyAvailableUsername("dicoding");
        racing.addUser(new RegisterUser("dicoding", "hashed", "Dicoding Indonesia"));

        assertThatThrownBy(() -> racing.addUser(new RegisterUser("dicoding", "other", "Someone Else")))
                .isInstanceOf(InvariantException.class)
                .hasMessage("username is not available");
        assertThat(db.count("users", "username = ?", "dicoding")).isEqualTo(1);
    }

    @Test
    void verifyAvailableUsername_shouldThrowWhenTaken() {
        db.addUser("user-1", "dicoding");

        assertThatThrownBy(() -> repository.verifyAvailableUsername("dicoding"))
                .isInstanceOf(InvariantException.class)
                .hasMessage("username is not available");
    }

    @Test
    void verifyAvailableUsername_shouldPassForFreshUsername() {
        assertThatCode(() -> repository.verifyAvailableUsername("dicoding")).doesNotThrowAnyException();
    }

    @Test
    void getPasswordByUsername_shouldReturnStoredHash() {
        repository.addUser(new RegisterUser("dicoding", "hashed", "Dicoding Indonesia"));

        assertThat(repository.getPasswordByUsername("dicoding")).isEqualTo("hashed");
    }

    @Test
    void getPasswordByUsername_shouldThrowForUnknownUser() {
        assertThatThrownBy(() -> repository.getPasswordByUsername("ghost"))
                .isInstanceOf(InvariantException.class);
    }

    @Test
    void getIdByUsername_shouldReturnId() {
        db.addUser("user-42", "dicoding");

        assertThat(repository.getIdByUsername("dicoding")).isEqualTo("user-42");
    }
}
