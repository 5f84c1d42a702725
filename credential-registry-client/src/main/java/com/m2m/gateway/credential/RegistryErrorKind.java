package com.m2m.gateway.credential;

/**
 * Classified outcome of a failed registry round trip. Callers branch on these, never on
 * raw transport detail.
 */
public enum RegistryErrorKind {
    CONFLICT,
    NOT_FOUND,
    UNAVAILABLE,
    TIMEOUT,
    UNKNOWN;

    public static RegistryErrorKind fromStatus(int status) {
        return switch (status) {
            case 409 -> CONFLICT;
            case 404 -> NOT_FOUND;
            default -> UNKNOWN;
        };
    }

    public boolean retryable() {
        return this == UNAVAILABLE || this == TIMEOUT;
    }
}
