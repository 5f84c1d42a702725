package com.m2m.gateway.credential.server;

import java.time.Duration;

import com.m2m.gateway.credential.model.NamedCredential;

/**
 * Signs gateway tokens with a registry credential.
 */
public interface TokenMinter {
    record MintedToken(String token, TokenClaims claims) {}

    /**
     * @param ttl requested lifetime; {@code null} for the configured default, clamped to the configured maximum
     */
    MintedToken mint(String principal, NamedCredential credential, Duration ttl);
}
