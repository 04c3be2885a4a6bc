package com.rls.scoped.auth.issuer;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import com.rls.scoped.auth.issuer.error.ValidationException;

/**
 * Maps a subject, role and custom claims onto a {@link ClaimSet}. Pure: the issue time is passed in.
 */
public final class ClaimBuilder {

    public static final String DEFAULT_ROLE = "authenticated";
    public static final String DEFAULT_AUDIENCE = "authenticated";

    private final String audience;
    private final String issuer;

    public ClaimBuilder() {
        this(DEFAULT_AUDIENCE, null);
    }

    public ClaimBuilder(String audience, String issuer) {
        this.audience = Objects.requireNonNull(audience, "audience");
        this.issuer = issuer;
    }

    public ClaimSet buildClaims(String subject, String role, Map<String, ?> customClaims, Instant now, Duration validity) {
        if (subject == null || subject.isBlank()) {
            throw new ValidationException("subject cannot be empty");
        }
        if (validity == null || validity.getSeconds() <= 0) {
            throw new ValidationException("validity must be at least one second, got " + validity);
        }
        Objects.requireNonNull(now, "now");
        if (customClaims != null) {
            customClaims.forEach(ClaimBuilder::checkCustomClaim);
        }

        long iat = now.getEpochSecond();
        long exp = iat + validity.getSeconds();
        String effectiveRole = (role == null || role.isBlank()) ? DEFAULT_ROLE : role;

        Map<String, Object> custom = customClaims == null ? null : Map.<String, Object>copyOf(customClaims);
        return new ClaimSet(subject, effectiveRole, audience, issuer, iat, exp, custom);
    }

    private static void checkCustomClaim(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("custom claim name cannot be empty");
        }
        if (ClaimSet.RESERVED.contains(key)) {
            throw new ValidationException("custom claim '" + key + "' would shadow a reserved claim");
        }
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new ValidationException("custom claim '" + key + "' must be a string, number or boolean");
        }
        // covers BigDecimal and BigInteger outside double range too, which would otherwise widen to infinity
        if (value instanceof Number n && !Double.isFinite(n.doubleValue())) {
            throw new ValidationException("custom claim '" + key + "' must be a finite number");
        }
    }
}
