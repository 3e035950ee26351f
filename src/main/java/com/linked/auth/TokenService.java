package com.linked.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Signs and verifies HS256 session tokens. Stateless: output depends only on the subject,
 * the secret and the clock.
 */
public class TokenService {

    public static final Duration DEFAULT_TTL = Duration.ofDays(30);

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;

    public TokenService(String secret) {
        this(secret, DEFAULT_TTL, Clock.systemUTC());
    }

    public TokenService(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("token secret must not be empty");
        }
        this.key = deriveKey(secret);
        this.ttl = ttl;
        this.clock = clock;
    }

    public Duration getTtl() {
        return ttl;
    }

    public String sign(String subject) {
        // JWT dates carry whole seconds only
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * @throws InvalidTokenException with {@link InvalidTokenException.Reason#INVALID_SIGNATURE} when the
     *         MAC does not match, {@link InvalidTokenException.Reason#EXPIRED} when the signature is good
     *         but the expiry has passed, {@link InvalidTokenException.Reason#MALFORMED} otherwise
     */
    public SessionClaims verify(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, e);
        } catch (SignatureException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.INVALID_SIGNATURE, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, e);
        }

        if (claims.getSubject() == null || claims.getIssuedAt() == null || claims.getExpiration() == null) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, null);
        }
        return new SessionClaims(
                claims.getSubject(),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant());
    }

    // HS256 needs a 256-bit key; hashing lets operators use a secret of any length.
    private static SecretKey deriveKey(String secret) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return Keys.hmacShaKeyFor(md.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
