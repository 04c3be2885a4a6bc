package com.rls.scoped.auth;

public enum RefreshState {
    /** Remaining lifetime is above the refresh threshold. */
    FRESH,
    /** Within the refresh threshold; the next caller re-issues. */
    STALE,
    /** A re-issuance is in flight and callers are waiting on it. */
    REFRESHING,
    /** Terminal. */
    DISCARDED
}
