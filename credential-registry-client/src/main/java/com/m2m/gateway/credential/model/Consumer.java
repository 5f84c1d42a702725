package com.m2m.gateway.credential.model;

import java.util.Objects;

/**
 * Registry-side account for a principal. {@code username} is unique in the registry.
 */
public record Consumer(String id, String username, String customId, Long createdAt) {

    public Consumer {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Reference used in registry paths; the registry accepts either id or username.
     */
    public String ref() {
        return id;
    }
}
