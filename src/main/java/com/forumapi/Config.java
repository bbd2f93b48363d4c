package com.forumapi;

/**
 * Process configuration, read once from the environment at startup.
 */
public record Config(int port,
                     String databaseUrl,
                     int poolMax,
                     int poolMin,
                     int poolIdleTimeoutSeconds,
                     int poolMaxLifetimeSeconds,
                     int poolAcquireTimeoutSeconds,
                     String accessTokenKey,
                     String refreshTokenKey,
                     int accessTokenAgeSeconds) {

    public static Config fromEnv() {
        return new Config(
                envInt("PORT", 5000),
                require("DATABASE_URL"),
                envInt("DB_POOL_MAX", 10),
                envInt("DB_POOL_MIN", 5),
                envInt("DB_POOL_IDLE_TIMEOUT", 300),
                envInt("DB_POOL_MAX_LIFETIME", 1800),
                envInt("DB_POOL_ACQUIRE_TIMEOUT", 10),
                require("ACCESS_TOKEN_KEY"),
                require("REFRESH_TOKEN_KEY"),
                envInt("ACCESS_TOKEN_AGE", 3000));
    }

    private static String require(String key) {
        String v = System.getenv(key);
        if (v == null || v.isEmpty()) {
            throw new IllegalStateException(key + " must be set");
        }
        return v;
    }

    private static int envInt(String key, int fallback) {
        String v = System.getenv(key);
        if (v == null || v.isEmpty()) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
