package com.forumapi.infrastructure.security;

import com.forumapi.Config;
import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.TokenPayload;
import com.forumapi.commons.exceptions.AuthenticationException;
import com.forumapi.commons.exceptions.InvariantException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

/**
 * HMAC-signed tokens. Access and refresh tokens are signed with different keys so one can never be
 * used in place of the other. Every token carries a random id, so two logins never share a refresh
 * token. Refresh tokens carry no expiry; logout revokes them.
 */
public final class JwtTokenManager implements AuthenticationTokenManager {

    private static final String USERNAME_CLAIM = "username";

    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final long accessTokenAgeMs;

    public JwtTokenManager(Config config) {
        this(config.accessTokenKey(), config.refreshTokenKey(), config.accessTokenAgeSeconds());
    }

    public JwtTokenManager(String accessTokenKey, String refreshTokenKey, int accessTokenAgeSeconds) {
        this.accessKey = hmacKey(accessTokenKey);
        this.refreshKey = hmacKey(refreshTokenKey);
        this.accessTokenAgeMs = accessTokenAgeSeconds * 1000L;
    }

    @Override
    public String createAccessToken(TokenPayload payload) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(payload.id())
                .claim(USERNAME_CLAIM, payload.username())
                .issuedAt(new Date(now))
                .expiration(new Date(now + accessTokenAgeMs))
                .signWith(accessKey)
                .compact();
    }

    @Override
    public String createRefreshToken(TokenPayload payload) {
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(payload.id())
                .claim(USERNAME_CLAIM, payload.username())
                .issuedAt(new Date())
                .signWith(refreshKey)
                .compact();
    }

    @Override
    public TokenPayload verifyAccessToken(String token) {
        try {
            return toPayload(parse(token, accessKey));
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Invalid access token");
        }
    }

    @Override
    public void verifyRefreshToken(String token) {
        try {
            parse(token, refreshKey);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvariantException("refresh token is not valid");
        }
    }

    @Override
    public TokenPayload decodePayload(String token) {
        return toPayload(parse(token, refreshKey));
    }

    private static Claims parse(String token, SecretKey key) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private static TokenPayload toPayload(Claims claims) {
        return new TokenPayload(claims.getSubject(), claims.get(USERNAME_CLAIM, String.class));
    }

    private static SecretKey hmacKey(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalStateException("token key must not be empty");
        }
        // Pad to at least 32 bytes, the HS256 minimum
        while (secret.length() < 32) {
            secret = secret + secret;
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
