package com.forumapi.domain.comment;

import com.forumapi.domain.reply.DetailReply;
import com.forumapi.domain.reply.Reply;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetailCommentTest {

    private static final Instant DATE = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void of_shouldKeepContentOfLiveComment() {
        var comment = new Comment("comment-1", "thread-1", "dicoding", "nice", DATE, false);

        DetailComment detail = DetailComment.of(comment, List.of(), 3);

        assertThat(detail.content()).isEqualTo("nice");
        assertThat(detail.likeCount()).isEqualTo(3);
        assertThat(detail.username()).isEqualTo("dicoding");
    }

    @Test
    void of_shouldMaskDeletedCommentButKeepReplies() {
        var comment = new Comment("comment-1", "thread-1", "dicoding", "nice", DATE, true);
        var reply = DetailReply.of(new Reply("reply-1", "comment-1", "johndoe", "thanks", DATE, false));

        DetailComment detail = DetailComment.of(comment, List.of(reply), 0);

        assertThat(detail.content()).isEqualTo(DetailComment.DELETED_CONTENT);
        assertThat(detail.replies()).containsExactly(reply);
    }

    @Test
    void detailReply_shouldMaskDeletedReply() {
        var reply = new Reply("reply-1", "comment-1", "johndoe", "thanks", DATE, true);

        assertThat(DetailReply.of(reply).content()).isEqualTo(DetailReply.DELETED_CONTENT);
    }
}
