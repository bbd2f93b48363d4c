package com.forumapi.domain.comment;

public record AddedComment(String id, String content, String owner) {
}
