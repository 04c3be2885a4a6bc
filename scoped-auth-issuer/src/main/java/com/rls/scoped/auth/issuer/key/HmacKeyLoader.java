package com.rls.scoped.auth.issuer.key;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;

import com.rls.scoped.auth.issuer.error.ConfigurationException;

import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;

public final class HmacKeyLoader {

    /** HS256 needs a key at least as long as its 256-bit output. */
    public static final int MIN_SECRET_BYTES = 32;

    private HmacKeyLoader() {}

    public static SecretKey loadHs256Key(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("jwtSecret", "cannot be empty");
        }
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length < MIN_SECRET_BYTES) {
            throw new ConfigurationException("jwtSecret", "must be at least " + MIN_SECRET_BYTES + " bytes, got " + raw.length);
        }
        try {
            return Keys.hmacShaKeyFor(raw);
        } catch (WeakKeyException e) {
            throw new ConfigurationException("jwtSecret", e.getMessage());
        }
    }
}
