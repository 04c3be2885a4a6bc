package com.rls.scoped.auth.issuer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import com.rls.scoped.auth.issuer.error.ClientException;

import lombok.AllArgsConstructor;

/**
 * Builds claims with {@link ClaimBuilder} and signs them with an HS256 {@link TokenSigner}.
 */
@AllArgsConstructor
public final class HmacScopedTokenIssuer implements TokenIssuer {

    private final ClaimBuilder claimBuilder;
    private final TokenSigner signer;

    public HmacScopedTokenIssuer(ScopedAuthConfig config) {
        this(config, Clock.systemUTC());
    }

    public HmacScopedTokenIssuer(ScopedAuthConfig config, Clock clock) {
        this(new ClaimBuilder(ClaimBuilder.DEFAULT_AUDIENCE, config.issuerUrl()),
            new HmacTokenSigner(config.getJwtSecret(), clock));
    }

    @Override
    public Token issue(String subject, String role, Map<String, ?> customClaims, Duration validity, Instant now) {
        if (subject == null || subject.isBlank()) {
            throw new ClientException("subject cannot be empty");
        }
        ClaimSet claims = claimBuilder.buildClaims(subject, role, customClaims, now, validity);
        return Token.of(signer.sign(claims), claims);
    }

    @Override
    public ClaimSet verify(String token) {
        return signer.verify(token);
    }
}
