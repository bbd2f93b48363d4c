package com.forumapi.infrastructure.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class SqlLoader {

    public final String addUser;
    public final String usernameExists;
    public final String getPasswordByUsername;
    public final String getIdByUsername;
    public final String addToken;
    public final String tokenExists;
    public final String deleteToken;
    public final String addThread;
    public final String threadExists;
    public final String getThread;
    public final String addComment;
    public final String commentExists;
    public final String getCommentOwner;
    public final String deleteComment;
    public final String listCommentsByThread;
    public final String addReply;
    public final String replyExists;
    public final String getReplyOwner;
    public final String deleteReply;
    public final String listRepliesByThread;
    public final String likeExists;
    public final String addLike;
    public final String deleteLike;
    public final String countLikesByThread;

    public SqlLoader() {
        addUser = load("users/add.sql");
        usernameExists = load("users/exists_username.sql");
        getPasswordByUsername = load("users/get_password.sql");
        getIdByUsername = load("users/get_id.sql");
        addToken = load("authentications/add.sql");
        tokenExists = load("authentications/exists.sql");
        deleteToken = load("authentications/delete.sql");
        addThread = load("threads/add.sql");
        threadExists = load("threads/exists.sql");
        getThread = load("threads/get.sql");
        addComment = load("comments/add.sql");
        commentExists = load("comments/exists.sql");
        getCommentOwner = load("comments/get_owner.sql");
        deleteComment = load("comments/delete.sql");
        listCommentsByThread = load("comments/list_by_thread.sql");
        addReply = load("replies/add.sql");
        replyExists = load("replies/exists.sql");
        getReplyOwner = load("replies/get_owner.sql");
        deleteReply = load("replies/delete.sql");
        listRepliesByThread = load("replies/list_by_thread.sql");
        likeExists = load("likes/exists.sql");
        addLike = load("likes/add.sql");
        deleteLike = load("likes/delete.sql");
        countLikesByThread = load("likes/count_by_thread.sql");
    }

    static String load(String relative) {
        String path = "queries/" + relative;
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            // Convert PostgreSQL $1, $2 placeholders to JDBC ? placeholders
            return sql.replaceAll("\\$\\d+", "?");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load SQL: " + path, e);
        }
    }
}
