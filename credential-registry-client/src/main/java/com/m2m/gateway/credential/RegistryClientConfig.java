package com.m2m.gateway.credential;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RegistryClientConfig {

    public static final String ENV_ADMIN_URL = "KONG_ADMIN_URL";
    public static final String ENV_ADMIN_TOKEN = "KONG_ADMIN_TOKEN";
    public static final String ENV_CONNECT_TIMEOUT = "KONG_CONNECT_TIMEOUT_SECONDS";
    public static final String ENV_REQUEST_TIMEOUT = "KONG_REQUEST_TIMEOUT_SECONDS";

    private URI adminUrl = URI.create("http://localhost:8001");
    private String adminToken;
    private String adminTokenHeader = "Kong-Admin-Token";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration requestTimeout = Duration.ofSeconds(10);

    public RegistryAuthHeader authHeader() {
        return new RegistryAuthHeader(adminTokenHeader, adminToken);
    }

    public static RegistryClientConfig fromEnvironment(Map<String, String> env) {
        RegistryClientConfig config = new RegistryClientConfig();
        String url = env.get(ENV_ADMIN_URL);
        if (url != null && !url.isBlank()) {
            config.setAdminUrl(URI.create(url.trim()));
        }
        config.setAdminToken(env.get(ENV_ADMIN_TOKEN));
        config.setConnectTimeout(seconds(env, ENV_CONNECT_TIMEOUT, config.getConnectTimeout()));
        config.setRequestTimeout(seconds(env, ENV_REQUEST_TIMEOUT, config.getRequestTimeout()));
        return config;
    }

    private static Duration seconds(Map<String, String> env, String key, Duration fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            long value = Long.parseLong(raw.trim());
            if (value <= 0) throw new IllegalArgumentException(key + " must be positive: " + raw);
            return Duration.ofSeconds(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }
}
