package com.m2m.gateway.credential.model;

import java.util.Objects;

/**
 * A JWT credential held by the registry under one consumer. {@code name} is the value the
 * gateway matches against the token's key claim and is unique across the whole registry.
 * {@code secret} is base64 encoded and may be absent on records read back from a listing.
 */
public record NamedCredential(
    String id,
    String consumerId,
    String name,
    String secret,
    String algorithm,
    Long createdAt
) {
    public static final String ALGORITHM = "HS256";

    public NamedCredential {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        algorithm = (algorithm == null || algorithm.isBlank()) ? ALGORITHM : algorithm;
    }

    public boolean hasSecret() {
        return secret != null && !secret.isEmpty();
    }

    public NamedCredential withoutSecret() {
        return new NamedCredential(id, consumerId, name, null, algorithm, createdAt);
    }

    @Override
    public String toString() {
        return "NamedCredential[id=" + id
            + ", consumerId=" + consumerId
            + ", name=" + name
            + ", secret=" + (hasSecret() ? "***" : "none")
            + ", algorithm=" + algorithm
            + ", createdAt=" + createdAt + "]";
    }
}
