package com.forumapi.interfaces.http;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.application.usecase.AddCommentUseCase;
import com.forumapi.application.usecase.DeleteCommentUseCase;
import com.forumapi.domain.comment.AddedComment;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

import java.util.Map;

public final class CommentHandler {

    private final AddCommentUseCase addComment;
    private final DeleteCommentUseCase deleteComment;
    private final AuthenticationTokenManager tokens;

    public CommentHandler(AddCommentUseCase addComment,
                          DeleteCommentUseCase deleteComment,
                          AuthenticationTokenManager tokens) {
        this.addComment = addComment;
        this.deleteComment = deleteComment;
        this.tokens = tokens;
    }

    public void create(Context ctx) {
        TokenPayload user = Middleware.requireAuth(ctx, tokens);

        var payload = Middleware.payload(ctx);
        payload.put("threadId", ctx.pathParam("threadId"));
        payload.put("owner", user.id());

        AddedComment addedComment = addComment.execute(payload);
        ctx.status(HttpStatus.CREATED).json(ApiResponse.success("addedComment", addedComment));
    }

    public void delete(Context ctx) {
        TokenPayload user = Middleware.requireAuth(ctx, tokens);

        deleteComment.execute(Map.of(
                "commentId", ctx.pathParam("commentId"),
                "threadId", ctx.pathParam("threadId"),
                "owner", user.id()));
        ctx.json(ApiResponse.success());
    }
}
