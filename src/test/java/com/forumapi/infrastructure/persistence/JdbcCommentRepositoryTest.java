package com.forumapi.infrastructure.persistence;

import com.forumapi.commons.exceptions.AuthorizationException;
import com.forumapi.commons.exceptions.NotFoundException;
import com.forumapi.domain.comment.AddedComment;
import com.forumapi.domain.comment.Comment;
import com.forumapi.domain.comment.NewComment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcCommentRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private TestDatabase db;
    private JdbcCommentRepository repository;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        db.addUser("user-1", "dicoding");
        db.addUser("user-2", "johndoe");
        db.addThread("thread-1", "user-1", NOW);
        repository = new JdbcCommentRepository(db.dataSource(), new SqlLoader(), prefix -> prefix + "-123",
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void addComment_shouldPersistAndReturnAddedComment() {
        AddedComment added = repository.addComment(new NewComment("nice", "thread-1", "user-2"));

        assertThat(added).isEqualTo(new AddedComment("comment-123", "nice", "user-2"));
        assertThat(db.isDeleted("comments", "comment-123")).isFalse();
    }

    @Test
    void verifyCommentExists_shouldRequireCommentInGivenThread() {
        db.addThread("thread-2", "user-1", NOW);
        db.addComment("comment-1", "thread-1", "user-2", "nice", NOW);

        assertThatCode(() -> repository.verifyCommentExists("comment-1", "thread-1")).doesNotThrowAnyException();
        assertThatThrownBy(() -> repository.verifyCommentExists("comment-1", "thread-2"))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> repository.verifyCommentExists("comment-x", "thread-1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void verifyCommentOwner_shouldRejectOtherUsers() {
        db.addComment("comment-1", "thread-1", "user-2", "nice", NOW);

        assertThatCode(() -> repository.verifyCommentOwner("comment-1", "user-2")).doesNotThrowAnyException();
        assertThatThrownBy(() -> repository.verifyCommentOwner("comment-1", "user-1"))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void deleteComment_shouldSoftDelete() {
        db.addComment("comment-1", "thread-1", "user-2", "nice", NOW);

        repository.deleteComment("comment-1");

        assertThat(db.isDeleted("comments", "comment-1")).isTrue();
        assertThat(db.count("comments", "id = ?", "comment-1")).isEqualTo(1);
    }

    @Test
    void deleteComment_shouldThrowNotFoundForUnknownComment() {
        assertThatThrownBy(() -> repository.deleteComment("comment-x"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void getCommentsByThreadId_shouldReturnOldestFirstIncludingDeleted() {
        db.addComment("comment-2", "thread-1", "user-1", "second", NOW.plusSeconds(60));
        db.addComment("comment-1", "thread-1", "user-2", "first", NOW);
        repository.deleteComment("comment-2");

        List<Comment> comments = repository.getCommentsByThreadId("thread-1");

        assertThat(comments).extracting(Comment::id).containsExactly("comment-1", "comment-2");
        assertThat(comments.get(0).username()).isEqualTo("johndoe");
        assertThat(comments.get(0).date()).isEqualTo(NOW);
        assertThat(comments.get(1).deleted()).isTrue();
        assertThat(comments.get(1).content()).isEqualTo("second");
    }
}
