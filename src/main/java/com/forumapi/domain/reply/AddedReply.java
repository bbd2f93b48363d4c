package com.forumapi.domain.reply;

public record AddedReply(String id, String content, String owner) {
}
