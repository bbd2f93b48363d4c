package com.forumapi.interfaces.http;

import com.forumapi.application.usecase.AddUserUseCase;
import com.forumapi.domain.user.RegisteredUser;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

public final class UserHandler {

    private final AddUserUseCase addUser;

    public UserHandler(AddUserUseCase addUser) {
        this.addUser = addUser;
    }

    public void create(Context ctx) {
        RegisteredUser addedUser = addUser.execute(Middleware.payload(ctx));
        ctx.status(HttpStatus.CREATED).json(ApiResponse.success("addedUser", addedUser));
    }
}
