package com.m2m.gateway.credential.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;

import com.m2m.gateway.credential.model.NamedCredential;
import com.m2m.gateway.credential.server.key.CredentialSecrets;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.AllArgsConstructor;

/**
 * HS256 implementation using JJWT. The key id goes into the claim named by
 * {@code keyClaimName}, which must be the claim the gateway plugin reads
 * ({@code key_claim_name}).
 */
@AllArgsConstructor
public final class HmacTokenMinter implements TokenMinter {
    private final String keyClaimName;
    private final Duration defaultTtl;
    private final Duration maxTtl;
    private final Clock clock;

    public HmacTokenMinter(LifecycleConfig config) {
        this(config.getKeyClaimName(), config.getDefaultTokenTtl(), config.getMaxTokenTtl(), Clock.systemUTC());
    }

    @Override
    public MintedToken mint(String principal, NamedCredential credential, Duration ttl) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(credential, "credential");
        byte[] key = CredentialSecrets.decode(credential.secret());

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        TokenClaims claims = new TokenClaims(principal, credential.name(), now, now.plus(effectiveTtl(ttl)));

        String jwt = Jwts.builder()
            .subject(claims.subject())
            .claim(keyClaimName, claims.keyId())
            .issuedAt(Date.from(claims.issuedAt()))
            .expiration(Date.from(claims.expiresAt()))
            .signWith(Keys.hmacShaKeyFor(key), Jwts.SIG.HS256)
            .compact();

        return new MintedToken(jwt, claims);
    }

    Duration effectiveTtl(Duration requested) {
        Duration ttl = (requested == null || requested.isZero() || requested.isNegative()) ? defaultTtl : requested;
        return ttl.compareTo(maxTtl) > 0 ? maxTtl : ttl;
    }
}
