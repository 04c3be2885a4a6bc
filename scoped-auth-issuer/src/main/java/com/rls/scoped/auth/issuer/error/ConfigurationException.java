package com.rls.scoped.auth.issuer.error;

import lombok.Getter;

/**
 * Missing or invalid configuration value. Fatal at startup.
 */
@Getter
public class ConfigurationException extends ScopedAuthException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final String reason;

    public ConfigurationException(String fieldName, String reason) {
        super(fieldName + " - " + reason);
        this.fieldName = fieldName;
        this.reason = reason;
    }
}
