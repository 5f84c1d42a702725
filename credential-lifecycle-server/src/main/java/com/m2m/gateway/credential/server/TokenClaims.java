package com.m2m.gateway.credential.server;

import java.time.Instant;

/**
 * Payload of a minted token. {@code keyId} is the name of the credential that signed it.
 */
public record TokenClaims(String subject, String keyId, Instant issuedAt, Instant expiresAt) {}
