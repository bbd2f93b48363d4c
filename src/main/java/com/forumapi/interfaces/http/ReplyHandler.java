package com.forumapi.interfaces.http;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.application.usecase.AddReplyUseCase;
import com.forumapi.application.usecase.DeleteReplyUseCase;
import com.forumapi.domain.reply.AddedReply;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

import java.util.Map;

public final class ReplyHandler {

    private final AddReplyUseCase addReply;
    private final DeleteReplyUseCase deleteReply;
    private final AuthenticationTokenManager tokens;

    public ReplyHandler(AddReplyUseCase addReply,
                        DeleteReplyUseCase deleteReply,
                        AuthenticationTokenManager tokens) {
        this.addReply = addReply;
        this.deleteReply = deleteReply;
        this.tokens = tokens;
    }

    public void create(Context ctx) {
        TokenPayload user = Middleware.requireAuth(ctx, tokens);

        var payload = Middleware.payload(ctx);
        payload.put("threadId", ctx.pathParam("threadId"));
        payload.put("commentId", ctx.pathParam("commentId"));
        payload.put("owner", user.id());

        AddedReply addedReply = addReply.execute(payload);
        ctx.status(HttpStatus.CREATED).json(ApiResponse.success("addedReply", addedReply));
    }

    public void delete(Context ctx) {
        TokenPayload user = Middleware.requireAuth(ctx, tokens);

        deleteReply.execute(Map.of(
                "replyId", ctx.pathParam("replyId"),
                "commentId", ctx.pathParam("commentId"),
                "threadId", ctx.pathParam("threadId"),
                "owner", user.id()));
        ctx.json(ApiResponse.success());
    }
}
