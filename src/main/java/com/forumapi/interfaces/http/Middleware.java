package com.forumapi.interfaces.http;

import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.commons.exceptions.AuthenticationException;
import com.forumapi.commons.exceptions.InvariantException;
import io.javalin.http.Context;

import java.util.HashMap;
import java.util.Map;

public final class Middleware {

  private Middleware() {
  }

  /**
   * Returns the identity behind the bearer token of the request.
   *
   * @throws AuthenticationException if the header is absent or the token does not verify
   */
  public static TokenPayload requireAuth(Context ctx, AuthenticationTokenManager tokens) {
    String auth = ctx.header("Authorization");
    if (auth == null || !auth.startsWith("Bearer ")) {
      throw new AuthenticationException("Missing authentication");
    }
    return tokens.verifyAccessToken(auth.substring(7));
  }

  /**
   * Parses the request body as a JSON object into a mutable map. An empty body reads as an
   * empty object so that entity validation reports the missing properties.
   */
  public static Map<String, Object> payload(Context ctx) {
    String body = ctx.body();
    if (body.isBlank()) {
      return new HashMap<>();
    }
    try {
      Map<String, Object> parsed = ctx.jsonMapper().fromJsonString(body, Map.class);
      return parsed == null ? new HashMap<>() : new HashMap<>(parsed);
    } catch (Exception e) {
      throw new InvariantException("request body must be a JSON object");
    }
  }
}
