package com.docrepo.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for token issuance and password hashing. Built explicitly and handed
 * to the components that need it.
 */
public record AuthSettings(
        String secretKey,
        String tokenAlgorithm,
        Duration accessTokenExpiry,
        String hashScheme
) {
    public static final String DEFAULT_TOKEN_ALGORITHM = "HS256";
    public static final Duration DEFAULT_ACCESS_TOKEN_EXPIRY = Duration.ofMinutes(30);
    public static final String DEFAULT_HASH_SCHEME = "bcrypt";

    public AuthSettings {
        Objects.requireNonNull(secretKey, "secretKey");
        Objects.requireNonNull(tokenAlgorithm, "tokenAlgorithm");
        Objects.requireNonNull(accessTokenExpiry, "accessTokenExpiry");
        Objects.requireNonNull(hashScheme, "hashScheme");
        if (accessTokenExpiry.isNegative() || accessTokenExpiry.isZero()) {
            throw new IllegalArgumentException("accessTokenExpiry must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads SECRET_KEY, TOKEN_ALGORITHM, ACCESS_TOKEN_EXPIRE_MINUTES and
     * HASH_SCHEME. Only SECRET_KEY is required.
     */
    public static AuthSettings fromEnvironment(Map<String, String> env) {
        String secret = env.get("SECRET_KEY");
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("SECRET_KEY must be set");
        }
        Builder builder = builder().secretKey(secret);
        if (env.containsKey("TOKEN_ALGORITHM")) {
            builder.tokenAlgorithm(env.get("TOKEN_ALGORITHM"));
        }
        if (env.containsKey("ACCESS_TOKEN_EXPIRE_MINUTES")) {
            builder.accessTokenExpiry(Duration.ofMinutes(Long.parseLong(env.get("ACCESS_TOKEN_EXPIRE_MINUTES"))));
        }
        if (env.containsKey("HASH_SCHEME")) {
            builder.hashScheme(env.get("HASH_SCHEME"));
        }
        return builder.build();
    }

    public static class Builder {
        private String secretKey;
        private String tokenAlgorithm = DEFAULT_TOKEN_ALGORITHM;
        private Duration accessTokenExpiry = DEFAULT_ACCESS_TOKEN_EXPIRY;
        private String hashScheme = DEFAULT_HASH_SCHEME;

        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey;
            return this;
        }

        public Builder tokenAlgorithm(String tokenAlgorithm) {
            this.tokenAlgorithm = tokenAlgorithm;
            return this;
        }

        public Builder accessTokenExpiry(Duration accessTokenExpiry) {
            this.accessTokenExpiry = accessTokenExpiry;
            return this;
        }

        public Builder hashScheme(String hashScheme) {
            this.hashScheme = hashScheme;
            return this;
        }

        public AuthSettings build() {
            return new AuthSettings(secretKey, tokenAlgorithm, accessTokenExpiry, hashScheme);
        }
    }
}
