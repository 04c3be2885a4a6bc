package com.rls.scoped.auth.issuer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Claims carried by a scoped token.
 *
 * <p>{@code issuer} may be null, in which case no {@code iss} claim is written. Custom claims are kept
 * sorted by key, with integral numbers widened to {@link Long} and decimals to {@link Double}, so a
 * claim set parsed back from a token compares equal to the one that was signed.
 */
public record ClaimSet(
    String subject,
    String role,
    String audience,
    String issuer,
    long issuedAt,
    long expiresAt,
    Map<String, Object> customClaims
) {

    public static final String SUBJECT = "sub";
    public static final String ROLE = "role";
    public static final String AUDIENCE = "aud";
    public static final String ISSUER = "iss";
    public static final String ISSUED_AT = "iat";
    public static final String EXPIRES_AT = "exp";

    /**
     * Names a custom claim may never use. {@code nbf} and {@code jti} are registered JWT claims the
     * signing library would reinterpret.
     */
    public static final Set<String> RESERVED = Set.of(SUBJECT, ROLE, AUDIENCE, ISSUER, ISSUED_AT, EXPIRES_AT, "nbf", "jti");

    public ClaimSet {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(audience, "audience");
        customClaims = normalize(customClaims);
    }

    public long validitySeconds() {
        return expiresAt - issuedAt;
    }

    private static Map<String, Object> normalize(Map<String, ?> claims) {
        if (claims == null || claims.isEmpty()) {
            return Collections.emptyMap();
        }
        TreeMap<String, Object> sorted = new TreeMap<>();
        claims.forEach((key, value) -> sorted.put(key, normalizeValue(value)));
        return Collections.unmodifiableMap(sorted);
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        if (value instanceof BigDecimal dec) {
            return dec.doubleValue();
        }
        return value;
    }
}
