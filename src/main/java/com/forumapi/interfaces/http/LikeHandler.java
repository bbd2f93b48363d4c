package com.forumapi.interfaces.http;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.application.usecase.LikeUnlikeCommentUseCase;
import io.javalin.http.Context;

import java.util.Map;

public final class LikeHandler {

    private final LikeUnlikeCommentUseCase likeUnlikeComment;
    private final AuthenticationTokenManager tokens;

    public LikeHandler(LikeUnlikeCommentUseCase likeUnlikeComment, AuthenticationTokenManager tokens) {
        this.likeUnlikeComment = likeUnlikeComment;
        this.tokens = tokens;
    }

    public void toggle(Context ctx) {
        TokenPayload user = Middleware.requireAuth(ctx, tokens);

        likeUnlikeComment.execute(Map.of(
                "threadId", ctx.pathParam("threadId"),
                "commentId", ctx.pathParam("commentId"),
                "owner", user.id()));
        ctx.json(ApiResponse.success());
    }
}
