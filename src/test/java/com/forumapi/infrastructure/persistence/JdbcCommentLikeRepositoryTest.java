package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.InvariantException;
import com.forumapi.domain.like.CommentLike;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcCommentLikeRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private TestDatabase db;
    private JdbcCommentLikeRepository repository;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        db.addUser("user-1", "dicoding");
        db.addUser("user-2", "johndoe");
        db.addThread("thread-1", "user-1", NOW);
        db.addComment("comment-1", "thread-1", "user-1", "first", NOW);
        db.addComment("comment-2", "thread-1", "user-1", "second", NOW);

        var sequence = new AtomicInteger();
        repository = new JdbcCommentLikeRepository(db.dataSource(), new SqlLoader(),
                prefix -> prefix + "-" + sequence.incrementAndGet(), Clock.systemUTC());
    }

    @Test
    void addLike_shouldMakeCommentLiked() {
        assertThat(repository.isLiked("comment-1", "user-2")).isFalse();

        repository.addLike(new CommentLike("thread-1", "comment-1", "user-2"));

        assertThat(repository.isLiked("comment-1", "user-2")).isTrue();
        assertThat(repository.isLiked("comment-1", "user-1")).isFalse();
    }

    @Test
    void addLike_shouldRejectSecondLikeOfSamePair() {
        repository.addLike(new CommentLike("thread-1", "comment-1", "user-2"));

        assertThatThrownBy(() -> repository.addLike(new CommentLike("thread-1", "comment-1", "user-2")))
                .isInstanceOf(InvariantException.class)
                .hasMessage("comment is already liked");
    }

    @Test
    void deleteLike_shouldRemoveOnlyThatPair() {
        db.addLike("like-a", "comment-1", "user-1");
        db.addLike("like-b", "comment-1", "user-2");

        repository.deleteLike("comment-1", "user-2");

        assertThat(repository.isLiked("comment-1", "user-2")).isFalse();
        assertThat(repository.isLiked("comment-1", "user-1")).isTrue();
    }

    @Test
    void getLikeCountsByThreadId_shouldCountPerComment() {
        db.addLike("like-a", "comment-1", "user-1");
        db.addLike("like-b", "comment-1", "user-2");

        Map<String, Integer> counts = repository.getLikeCountsByThreadId("thread-1");

        assertThat(counts).containsExactlyEntriesOf(Map.of("comment-1", 2));
    }
}
