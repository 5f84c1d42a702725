package com.m2m.gateway.credential;

import lombok.Getter;

/**
 * Failure of a single registry call. {@link #getStatus()} is {@code -1} when no HTTP
 * response was received.
 */
@Getter
public class RegistryException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final RegistryErrorKind kind;
    private final String operation;
    private final int status;
    private final String body;

    public RegistryException(RegistryErrorKind kind, String operation, int status, String body, Throwable cause) {
        super(describe(kind, operation, status, body), cause);
        this.kind = kind;
        this.operation = operation;
        this.status = status;
        this.body = body;
    }

    public RegistryException(RegistryErrorKind kind, String operation, String detail, Throwable cause) {
        super(kind + " during " + operation + ": " + detail, cause);
        this.kind = kind;
        this.operation = operation;
        this.status = NO_STATUS;
        this.body = null;
    }

    public static RegistryException ofStatus(String operation, int status, String body) {
        return new RegistryException(RegistryErrorKind.fromStatus(status), operation, status, body, null);
    }

    public boolean is(RegistryErrorKind expected) {
        return kind == expected;
    }

    private static String describe(RegistryErrorKind kind, String operation, int status, String body) {
        StringBuilder sb = new StringBuilder()
            .append(kind).append(" during ").append(operation);
        if (status != NO_STATUS) {
            sb.append(": HTTP ").append(status);
        }
        if (body != null && !body.isBlank()) {
            sb.append(" - ").append(body);
        }
        return sb.toString();
    }
}
