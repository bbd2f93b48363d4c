package com.forumapi.domain.thread;

import com.forumapi.domain.Payload;

import java.util.Map;

public record NewThread(String title, String body, String owner) {

    public static NewThread from(Map<String, ?> raw) {
        Payload payload = Payload.of("NEW_THREAD", raw).requireStrings("title", "body", "owner");
        return new NewThread(payload.string("title"), payload.string("body"), payload.string("owner"));
    }
}
