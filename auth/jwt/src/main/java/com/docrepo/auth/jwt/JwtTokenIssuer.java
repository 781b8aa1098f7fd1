package com.docrepo.auth.jwt;

import com.docrepo.core.TokenIssuer;
import com.docrepo.core.config.AuthSettings;
import com.docrepo.core.errors.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HMAC-signed JWTs. Every token expires {@link AuthSettings#accessTokenExpiry()}
 * after issue; verification checks signature and expiry.
 *
 * Verification failures surface as {@link InvalidTokenException}, answered with 403.
 */
public class JwtTokenIssuer implements TokenIssuer {
    private static final Logger logger = LoggerFactory.getLogger(JwtTokenIssuer.class);

    private final MacAlgorithm algorithm;
    private final SecretKey key;
    private final Duration expiry;
    private final Clock clock;

    public JwtTokenIssuer(AuthSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtTokenIssuer(AuthSettings settings, Clock clock) {
        String name = settings.tokenAlgorithm().toUpperCase(Locale.ROOT);
        this.algorithm = algorithmFor(name);
        byte[] secret = settings.secretKey().getBytes(StandardCharsets.UTF_8);
        if (secret.length * 8 < algorithm.getKeyBitLength()) {
            throw new IllegalArgumentException("Secret key for " + name + " must be at least "
                    + algorithm.getKeyBitLength() / 8 + " bytes");
        }
        this.key = new SecretKeySpec(secret, "HmacSHA" + name.substring(2));
        this.expiry = settings.accessTokenExpiry();
        this.clock = clock;
        logger.info("JWT issuer initialized with {} and expiry {}", name, expiry);
    }

    @Override
    public String issue(Map<String, Object> claims) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claims(claims)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiry)))
                .signWith(key, algorithm)
                .compact();
    }

    @Override
    public Map<String, Object> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return new LinkedHashMap<>(claims);
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("Rejected token: {}", e.getMessage());
            throw new InvalidTokenException(e.getMessage(), e);
        }
    }

    private static MacAlgorithm algorithmFor(String name) {
        switch (name) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalArgumentException("Unsupported token algorithm " + name);
        }
    }
}
