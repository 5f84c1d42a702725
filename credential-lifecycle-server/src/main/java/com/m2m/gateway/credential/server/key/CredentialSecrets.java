package com.m2m.gateway.credential.server.key;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Signing secrets for registry credentials. The registry stores them base64 encoded
 * ({@code secret_is_base64}); tokens are signed with the decoded bytes.
 */
public final class CredentialSecrets {

    public static final int SECRET_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private CredentialSecrets() {}

    public static String newSecret() {
        byte[] raw = new byte[SECRET_BYTES];
        RANDOM.nextBytes(raw);
        return Base64.getEncoder().encodeToString(raw);
    }

    public static byte[] decode(String base64Secret) {
        if (base64Secret == null || base64Secret.isBlank()) {
            throw new IllegalArgumentException("Credential has no secret");
        }
        try {
            return Base64.getDecoder().decode(base64Secret.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Credential secret is not valid base64", e);
        }
    }
}
