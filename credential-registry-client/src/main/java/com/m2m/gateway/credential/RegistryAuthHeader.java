package com.m2m.gateway.credential;

import java.net.http.HttpRequest;

/**
 * Admin API credential attached to every registry request. No header is sent when the
 * token is absent.
 */
public record RegistryAuthHeader(String headerName, String token) {

    public RegistryAuthHeader(String headerName, String token) {
        this.headerName = (headerName == null || headerName.isBlank())
            ? "Kong-Admin-Token"
            : headerName;
        this.token = (token == null || token.isBlank()) ? null : token;
    }

    public static RegistryAuthHeader none() {
        return new RegistryAuthHeader(null, null);
    }

    public HttpRequest.Builder add(HttpRequest.Builder builder) {
        return token == null ? builder : builder.header(headerName, token);
    }

    @Override
    public String toString() {
        return "RegistryAuthHeader[headerName=" + headerName + ", token=" + (token == null ? "none" : "***") + "]";
    }
}
