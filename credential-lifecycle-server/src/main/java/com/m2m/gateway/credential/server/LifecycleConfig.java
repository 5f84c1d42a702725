package com.m2m.gateway.credential.server;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LifecycleConfig {

    public static final String ENV_TOKEN_TTL = "JWT_EXPIRATION_SECONDS";
    public static final String ENV_MAX_TOKEN_TTL = "JWT_MAX_EXPIRATION_SECONDS";
    public static final String ENV_KEY_CLAIM = "JWT_KEY_CLAIM_NAME";
    public static final String ENV_NAME_ATTEMPTS = "CREDENTIAL_NAME_ATTEMPTS";

    /** Matches the gateway plugin's {@code maximum_expiration}. */
    public static final Duration ONE_YEAR = Duration.ofSeconds(31_536_000L);

    private static final Set<String> RESERVED_CLAIMS = Set.of("sub", "iat", "exp");

    private Duration defaultTokenTtl = ONE_YEAR;
    private Duration maxTokenTtl = ONE_YEAR;
    private String keyClaimName = "kid";
    private int nameAttempts = 3;

    public LifecycleConfig validate() {
        if (maxTokenTtl == null || maxTokenTtl.isZero() || maxTokenTtl.isNegative()) {
            throw new IllegalArgumentException("maxTokenTtl must be positive");
        }
        if (defaultTokenTtl == null || defaultTokenTtl.isZero() || defaultTokenTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTokenTtl must be positive");
        }
        if (keyClaimName == null || keyClaimName.isBlank() || RESERVED_CLAIMS.contains(keyClaimName)) {
            throw new IllegalArgumentException("keyClaimName must be a non-blank claim other than " + RESERVED_CLAIMS);
        }
        if (nameAttempts < 1) {
            throw new IllegalArgumentException("nameAttempts must be at least 1");
        }
        return this;
    }

    public static LifecycleConfig fromEnvironment(Map<String, String> env) {
        LifecycleConfig config = new LifecycleConfig();
        Long ttl = number(env, ENV_TOKEN_TTL);
        if (ttl != null) config.setDefaultTokenTtl(Duration.ofSeconds(ttl));
        Long max = number(env, ENV_MAX_TOKEN_TTL);
        if (max != null) config.setMaxTokenTtl(Duration.ofSeconds(max));
        String claim = env.get(ENV_KEY_CLAIM);
        if (claim != null && !claim.isBlank()) config.setKeyClaimName(claim.trim());
        Long attempts = number(env, ENV_NAME_ATTEMPTS);
        if (attempts != null) config.setNameAttempts(Math.toIntExact(attempts));
        return config.validate();
    }

    private static Long number(Map<String, String> env, String key) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return null;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }
}
