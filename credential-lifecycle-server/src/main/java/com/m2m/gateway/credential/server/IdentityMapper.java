package com.m2m.gateway.credential.server;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Derives the consumer key of a principal: a name-based (version 5, SHA-1) UUID in the
 * RFC 4122 DNS namespace. Stable across restarts and instances. The registry still
 * identifies consumers by username; the key is a correlation aid sent as {@code custom_id}.
 */
public final class IdentityMapper {

    public static final UUID DNS_NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    private final UUID namespace;

    public IdentityMapper() {
        this(DNS_NAMESPACE);
    }

    public IdentityMapper(UUID namespace) {
        if (namespace == null) throw new IllegalArgumentException("namespace required");
        this.namespace = namespace;
    }

    public UUID resolve(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("principal must not be blank");
        }
        byte[] hash = sha1(ByteBuffer.allocate(16 + principal.getBytes(StandardCharsets.UTF_8).length)
            .putLong(namespace.getMostSignificantBits())
            .putLong(namespace.getLeastSignificantBits())
            .put(principal.getBytes(StandardCharsets.UTF_8))
            .array());

        hash[6] &= 0x0f;
        hash[6] |= 0x50;  // version 5
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;  // IETF variant

        ByteBuffer bb = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bb.getLong(), bb.getLong());
    }

    private static byte[] sha1(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
