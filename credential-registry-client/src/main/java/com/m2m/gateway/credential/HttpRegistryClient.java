package com.m2m.gateway.credential;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.gateway.credential.model.Consumer;
import com.m2m.gateway.credential.model.NamedCredential;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link RegistryClient} over the Kong Admin API. Does not retry; unavailability and
 * timeouts are reported to the caller as classified {@link RegistryException}s.
 */
@Slf4j
public final class HttpRegistryClient implements RegistryClient {

    private final HttpClient http;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final RegistryAuthHeader authHeader;
    private final ObjectMapper mapper;

    public HttpRegistryClient(RegistryClientConfig config) {
        this(HttpClient.newBuilder().connectTimeout(config.getConnectTimeout()).build(),
            config.getAdminUrl(),
            config.getRequestTimeout(),
            config.authHeader());
    }

    public HttpRegistryClient(HttpClient http, URI adminUrl, Duration requestTimeout, RegistryAuthHeader authHeader) {
        this(http, adminUrl, requestTimeout, authHeader,
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public HttpRegistryClient(HttpClient http,
                              URI adminUrl,
                              Duration requestTimeout,
                              RegistryAuthHeader authHeader,
                              ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http");
        String url = Objects.requireNonNull(adminUrl, "adminUrl").toString();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.authHeader = authHeader == null ? RegistryAuthHeader.none() : authHeader;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static final class ConsumerResponse {
        @JsonProperty("id")
        String id;

        @JsonProperty("username")
        String username;

        @JsonProperty("custom_id")
        String customId;

        @JsonProperty("created_at")
        Long createdAt;

        Consumer toConsumer() {
            return new Consumer(id, username, customId, createdAt);
        }
    }

    static final class ConsumerIdResponse {
        @JsonProperty("id")
        String id;
    }

    static final class CredentialResponse {
        @JsonProperty("id")
        String id;

        @JsonProperty("key")
        String key;

        @JsonProperty("secret")
        String secret;

        @JsonProperty("algorithm")
        String algorithm;

        @JsonProperty("created_at")
        Long createdAt;

        @JsonProperty("consumer")
        ConsumerIdResponse consumer;

        NamedCredential toCredential() {
            return new NamedCredential(id, consumer == null ? null : consumer.id, key, secret, algorithm, createdAt);
        }
    }

    static final class ConsumerPage {
        @JsonProperty("data")
        List<ConsumerResponse> data;

        @JsonProperty("next")
        String next;
    }

    static final class CredentialPage {
        @JsonProperty("data")
        List<CredentialResponse> data;

        @JsonProperty("next")
        String next;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateConsumerRequest(
        @JsonProperty("username") String username,
        @JsonProperty("custom_id") String customId
    ) {}

    record CreateCredentialRequest(
        @JsonProperty("key") String key,
        @JsonProperty("secret") String secret,
        @JsonProperty("algorithm") String algorithm
    ) {}

    @Override
    public Consumer createConsumer(String username, String customId) {
        Objects.requireNonNull(username, "username");
        String op = "createConsumer";
        HttpResponse<String> resp = send(op, post("/consumers", new CreateConsumerRequest(username, customId)));
        requireSuccess(op, resp);
        return read(op, resp, ConsumerResponse.class).toConsumer();
    }

    @Override
    public Optional<Consumer> getConsumer(String usernameOrId) {
        String op = "getConsumer";
        HttpResponse<String> resp = send(op, get("/consumers/" + segment(usernameOrId)));
        if (resp.statusCode() == 404) return Optional.empty();
        requireSuccess(op, resp);
        return Optional.of(read(op, resp, ConsumerResponse.class).toConsumer());
    }

    @Override
    public NamedCredential createCredential(String consumerRef, String name, String secret) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(secret, "secret");
        String op = "createCredential";
        CreateCredentialRequest body = new CreateCredentialRequest(name, secret, NamedCredential.ALGORITHM);
        HttpResponse<String> resp = send(op, post("/consumers/" + segment(consumerRef) + "/jwt", body));
        requireSuccess(op, resp);
        NamedCredential created = read(op, resp, CredentialResponse.class).toCredential();
        if (!created.hasSecret()) {
            created = new NamedCredential(created.id(), created.consumerId(), created.name(), secret,
                created.algorithm(), created.createdAt());
        }
        return created;
    }

    @Override
    public List<NamedCredential> listCredentials(String consumerRef) {
        String op = "listCredentials";
        List<NamedCredential> result = new ArrayList<>();
        String path = "/consumers/" + segment(consumerRef) + "/jwt";
        while (path != null) {
            HttpResponse<String> resp = send(op, get(path));
            requireSuccess(op, resp);
            CredentialPage page = read(op, resp, CredentialPage.class);
            if (page.data != null) {
                page.data.forEach(c -> result.add(c.toCredential()));
            }
            path = nextPath(page.next);
        }
        return result;
    }

    @Override
    public DeleteOutcome deleteCredential(String consumerRef, String credentialId) {
        return delete("deleteCredential", "/consumers/" + segment(consumerRef) + "/jwt/" + segment(credentialId));
    }

    @Override
    public List<Consumer> listConsumers() {
        String op = "listConsumers";
        List<Consumer> result = new ArrayList<>();
        String path = "/consumers";
        while (path != null) {
            HttpResponse<String> resp = send(op, get(path));
            requireSuccess(op, resp);
            ConsumerPage page = read(op, resp, ConsumerPage.class);
            if (page.data != null) {
                page.data.forEach(c -> result.add(c.toConsumer()));
            }
            path = nextPath(page.next);
        }
        return result;
    }

    @Override
    public DeleteOutcome deleteConsumer(String usernameOrId) {
        return delete("deleteConsumer", "/consumers/" + segment(usernameOrId));
    }

    private DeleteOutcome delete(String op, String path) {
        HttpResponse<String> resp = send(op, request(path).DELETE().build());
        int sc = resp.statusCode();
        if (sc == 404) return DeleteOutcome.NOT_FOUND;
        requireSuccess(op, resp);
        return DeleteOutcome.DELETED;
    }

    private HttpRequest get(String path) {
        return request(path)
            .header("Accept", "application/json")
            .GET()
            .build();
    }

    private HttpRequest post(String path, Object body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize registry request for " + path, e);
        }
        return request(path)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
    }

    private HttpRequest.Builder request(String path) {
        URI target = isAbsolute(path) ? URI.create(path) : URI.create(baseUrl + path);
        HttpRequest.Builder builder = HttpRequest.newBuilder(target)
            .timeout(requestTimeout);
        return authHeader.add(builder);
    }

    private HttpResponse<String> send(String op, HttpRequest req) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} {} -> HTTP {}", op, req.method(), req.uri().getPath(), resp.statusCode());
            return resp;
        } catch (HttpTimeoutException e) {
            throw new RegistryException(RegistryErrorKind.TIMEOUT, op, "no response within " + requestTimeout, e);
        } catch (IOException e) {
            throw new RegistryException(RegistryErrorKind.UNAVAILABLE, op, "cannot reach registry at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(RegistryErrorKind.UNKNOWN, op, "interrupted", e);
        }
    }

    private static void requireSuccess(String op, HttpResponse<String> resp) {
        int sc = resp.statusCode();
        if (sc < 200 || sc >= 300) {
            throw RegistryException.ofStatus(op, sc, resp.body());
        }
    }

    private <T> T read(String op, HttpResponse<String> resp, Class<T> type) {
        try {
            T value = mapper.readValue(resp.body(), type);
            if (value == null) {
                throw new RegistryException(RegistryErrorKind.UNKNOWN, op, resp.statusCode(), resp.body(), null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new RegistryException(RegistryErrorKind.UNKNOWN, op, resp.statusCode(), resp.body(), e);
        }
    }

    /**
     * Kong returns {@code next} as a path relative to the admin root; absolute links are
     * followed as given.
     */
    private static String nextPath(String next) {
        if (next == null || next.isBlank()) return null;
        if (isAbsolute(next)) return next;
        return next.startsWith("/") ? next : "/" + next;
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("http://") || path.startsWith("https://");
    }

    private static String segment(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Registry path segment must not be blank");
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
