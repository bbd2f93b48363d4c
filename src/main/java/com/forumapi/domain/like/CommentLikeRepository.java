package com.forumapi.domain.like;

import java.util.Map;

public interface CommentLikeRepository {

    boolean isLiked(String commentId, String owner);

    /**
     * @throws com.forumapi.commons.exceptions.InvariantException if the pair is already stored
     */
    void addLike(CommentLike like);

    void deleteLike(String commentId, String owner);

    /**
     * Like counts keyed by comment id. Comments without likes are absent.
     */
    Map<String, Integer> getLikeCountsByThreadId(String threadId);
}
