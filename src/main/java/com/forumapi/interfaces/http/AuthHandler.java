package com.forumapi.interfaces.http;

import com.forumapi.application.usecase.LoginUserUseCase;
import com.forumapi.application.usecase.LogoutUserUseCase;
import com.forumapi.application.usecase.RefreshAuthenticationUseCase;
import com.forumapi.domain.auth.NewAuth;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

import java.util.Map;

public final class AuthHandler {

    private final LoginUserUseCase loginUser;
    private final RefreshAuthenticationUseCase refreshAuthentication;
    private final LogoutUserUseCase logoutUser;

    public AuthHandler(LoginUserUseCase loginUser,
                       RefreshAuthenticationUseCase refreshAuthentication,
                       LogoutUserUseCase logoutUser) {
        this.loginUser = loginUser;
        this.refreshAuthentication = refreshAuthentication;
        this.logoutUser = logoutUser;
    }

    public void login(Context ctx) {
        NewAuth auth = loginUser.execute(Middleware.payload(ctx));
        ctx.status(HttpStatus.CREATED).json(ApiResponse.success(Map.of(
                "accessToken", auth.accessToken(),
                "refreshToken", auth.refreshToken())));
    }

    public void refresh(Context ctx) {
        String accessToken = refreshAuthentication.execute(Middleware.payload(ctx));
        ctx.json(ApiResponse.success("accessToken", accessToken));
    }

    public void logout(Context ctx) {
        logoutUser.execute(Middleware.payload(ctx));
        ctx.json(ApiResponse.success());
    }
}
