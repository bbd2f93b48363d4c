package com.forumapi.domain.thread;

public record AddedThread(String id, String title, String owner) {
}
