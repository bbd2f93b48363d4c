package com.forumapi.interfaces.http;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.application.usecase.AddThreadUseCase;
import com.forumapi.application.usecase.GetThreadDetailUseCase;
import com.forumapi.domain.thread.AddedThread;
import com.forumapi.domain.thread.DetailThread;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

public final class ThreadHandler {

    private final AddThreadUseCase addThread;
    private final GetThreadDetailUseCase getThreadDetail;
    private final AuthenticationTokenManager tokens;

    public ThreadHandler(AddThreadUseCase addThread,
                         GetThreadDetailUseCase getThreadDetail,
                         AuthenticationTokenManager tokens) {
        this.addThread = addThread;
        this.getThreadDetail = getThreadDetail;
        this.tokens = tokens;
    }

    public void create(Context ctx) {
        TokenPayload user = Middleware.requireAuth(ctx, tokens);

        var payload = Middleware.payload(ctx);
        payload.put("owner", user.id());

        AddedThread addedThread = addThread.execute(payload);
        ctx.status(HttpStatus.CREATED).json(ApiResponse.success("addedThread", addedThread));
    }

    public void get(Context ctx) {
        DetailThread thread = getThreadDetail.execute(ctx.pathParam("threadId"));
        ctx.json(ApiResponse.success("thread", thread));
    }
}
