package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.NotFoundException;
import com.forumapi.domain.thread.AddedThread;
import com.forumapi.domain.thread.ForumThread;
import com.forumapi.domain.thread.NewThread;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcThreadRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private TestDatabase db;
    private JdbcThreadRepository repository;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        db.addUser("user-1", "dicoding");
        repository = new JdbcThreadRepository(db.dataSource(), new SqlLoader(), prefix -> prefix + "-123",
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void addThread_shouldPersistAndReturnAddedThread() {
        AddedThread added = repository.addThread(new NewThread("a title", "a body", "user-1"));

        assertThat(added).isEqualTo(new AddedThread("thread-123", "a title", "user-1"));
        assertThat(db.count("threads", "id = ?", "thread-123")).isEqualTo(1);
    }

    @Test
    void verifyThreadExists_shouldThrowNotFoundForUnknownThread() {
        assertThatThrownBy(() -> repository.verifyThreadExists("thread-x"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void verifyThreadExists_shouldPassForStoredThread() {
        db.addThread("thread-1", "user-1", NOW);

        assertThatCode(() -> repository.verifyThreadExists("thread-1")).doesNotThrowAnyException();
    }

    @Test
    void getThreadById_shouldJoinOwnerUsername() {
        repository.addThread(new NewThread("a title", "a body", "user-1"));

        ForumThread thread = repository.getThreadById("thread-123");

        assertThat(thread.id()).isEqualTo("thread-123");
        assertThat(thread.title()).isEqualTo("a title");
        assertThat(thread.body()).isEqualTo("a body");
        assertThat(thread.username()).isEqualTo("dicoding");
        assertThat(thread.date()).isEqualTo(NOW);
    }

    @Test
    void getThreadById_shouldThrowNotFoundForUnknownThread() {
        assertThatThrownBy(() -> repository.getThreadById("thread-x"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("thread not found");
    }
}
