package com.rls.scoped.auth.issuer;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.crypto.SecretKey;

import com.rls.scoped.auth.issuer.error.InvalidSignatureException;
import com.rls.scoped.auth.issuer.error.TokenException;
import com.rls.scoped.auth.issuer.error.TokenExpiredException;
import com.rls.scoped.auth.issuer.key.HmacKeyLoader;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.RequiredTypeException;

/**
 * HS256 implementation using JJWT.
 *
 * <p>Output is deterministic: the header carries only {@code typ} and {@code alg}, claims are written in a
 * fixed order and no {@code jti} is generated.
 */
public final class HmacTokenSigner implements TokenSigner {

    private final SecretKey key;
    private final Clock clock;
    private final JwtParser parser;

    public HmacTokenSigner(String secret, Clock clock) {
        this.key = HmacKeyLoader.loadHs256Key(secret);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.parser = Jwts.parser()
            .verifyWith(key)
            .clock(() -> Date.from(clock.instant()))
            .build();
    }

    @Override
    public String sign(ClaimSet claims) {
        Objects.requireNonNull(claims, "claims");
        try {
            JwtBuilder builder = Jwts.builder()
                .header().type("JWT").and()
                .subject(claims.subject())
                .claim(ClaimSet.ROLE, claims.role());
            singleAudience(builder, claims.audience());
            if (claims.issuer() != null) {
                builder.issuer(claims.issuer());
            }
            builder
                .issuedAt(Date.from(Instant.ofEpochSecond(claims.issuedAt())))
                .expiration(Date.from(Instant.ofEpochSecond(claims.expiresAt())));
            claims.customClaims().forEach(builder::claim);

            return builder.signWith(key, Jwts.SIG.HS256).compact();
        } catch (RuntimeException e) {
            throw new TokenException("failed to sign token for subject " + claims.subject(), e);
        }
    }

    @Override
    public ClaimSet verify(String token) {
        Claims payload;
        try {
            payload = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException(e.getClaims().getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidSignatureException("token signature could not be verified", e);
        }

        Date iat = payload.getIssuedAt();
        Date exp = payload.getExpiration();
        Set<String> audience = payload.getAudience();
        String role;
        try {
            role = payload.get(ClaimSet.ROLE, String.class);
        } catch (RequiredTypeException e) {
            throw new TokenException("token role claim is not a string", e);
        }
        if (payload.getSubject() == null || role == null || iat == null || exp == null || audience == null || audience.isEmpty()) {
            throw new TokenException("token is missing a mandatory claim");
        }

        // JJWT only rejects once now is strictly past exp; a token is already dead at exp itself
        long expiresAt = exp.toInstant().getEpochSecond();
        if (clock.instant().getEpochSecond() >= expiresAt) {
            throw new TokenExpiredException(Instant.ofEpochSecond(expiresAt));
        }

        Map<String, Object> custom = new HashMap<>();
        payload.forEach((name, value) -> {
            if (!ClaimSet.RESERVED.contains(name)) {
                custom.put(name, value);
            }
        });

        return new ClaimSet(
            payload.getSubject(),
            role,
            audience.iterator().next(),
            payload.getIssuer(),
            iat.toInstant().getEpochSecond(),
            expiresAt,
            custom
        );
    }

    // the backend expects a plain string here, not a one-element array
    @SuppressWarnings("deprecation")
    private static void singleAudience(JwtBuilder builder, String audience) {
        builder.audience().single(audience);
    }
}
