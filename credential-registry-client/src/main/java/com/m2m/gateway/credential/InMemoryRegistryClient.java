package com.m2m.gateway.credential;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.m2m.gateway.credential.model.Consumer;
import com.m2m.gateway.credential.model.NamedCredential;

import lombok.AllArgsConstructor;

/**
 * Registry kept in process memory with the same uniqueness rules as Kong: one consumer per
 * username, credential names unique across all consumers. Useful for local runs and tests.
 */
@AllArgsConstructor
public class InMemoryRegistryClient implements RegistryClient {

    private final Map<String, Consumer> consumersById;
    private final Map<String, String> consumerIdsByUsername;
    private final Map<String, NamedCredential> credentialsByName;
    private final Clock clock;

    public InMemoryRegistryClient() {
        this(new ConcurrentHashMap<>(), new ConcurrentHashMap<>(), new ConcurrentHashMap<>(), Clock.systemUTC());
    }

    @Override
    public Consumer createConsumer(String username, String customId) {
        if (username == null || username.isBlank()) {
            throw new RegistryException(RegistryErrorKind.UNKNOWN, "createConsumer", 400, "username required", null);
        }
        Consumer consumer = new Consumer(UUID.randomUUID().toString(), username, customId, now());
        // registered by id first so a username lookup never sees a dangling id
        consumersById.put(consumer.id(), consumer);
        if (consumerIdsByUsername.putIfAbsent(username, consumer.id()) != null) {
            consumersById.remove(consumer.id());
            throw new RegistryException(RegistryErrorKind.CONFLICT, "createConsumer", 409,
                "consumer '" + username + "' already exists", null);
        }
        return consumer;
    }

    @Override
    public Optional<Consumer> getConsumer(String usernameOrId) {
        return Optional.ofNullable(resolve(usernameOrId));
    }

    @Override
    public NamedCredential createCredential(String consumerRef, String name, String secret) {
        Consumer consumer = require("createCredential", consumerRef);
        NamedCredential credential = new NamedCredential(UUID.randomUUID().toString(), consumer.id(), name, secret,
            NamedCredential.ALGORITHM, now());
        if (credentialsByName.putIfAbsent(name, credential) != null) {
            throw new RegistryException(RegistryErrorKind.CONFLICT, "createCredential", 409,
                "credential key '" + name + "' already exists", null);
        }
        return credential;
    }

    @Override
    public List<NamedCredential> listCredentials(String consumerRef) {
        Consumer consumer = require("listCredentials", consumerRef);
        return credentialsByName.values().stream()
            .filter(c -> consumer.id().equals(c.consumerId()))
            .sorted(Comparator.comparing(NamedCredential::createdAt).thenComparing(NamedCredential::name))
            .toList();
    }

    @Override
    public DeleteOutcome deleteCredential(String consumerRef, String credentialId) {
        Consumer consumer = require("deleteCredential", consumerRef);
        for (NamedCredential c : credentialsByName.values()) {
            if (c.id().equals(credentialId) && consumer.id().equals(c.consumerId())) {
                return credentialsByName.remove(c.name(), c) ? DeleteOutcome.DELETED : DeleteOutcome.NOT_FOUND;
            }
        }
        return DeleteOutcome.NOT_FOUND;
    }

    @Override
    public List<Consumer> listConsumers() {
        return consumersById.values().stream()
            .sorted(Comparator.comparing(Consumer::username))
            .toList();
    }

    @Override
    public DeleteOutcome deleteConsumer(String usernameOrId) {
        Consumer consumer = resolve(usernameOrId);
        if (consumer == null || consumersById.remove(consumer.id()) == null) return DeleteOutcome.NOT_FOUND;
        consumerIdsByUsername.remove(consumer.username(), consumer.id());
        credentialsByName.values().removeIf(c -> consumer.id().equals(c.consumerId()));
        return DeleteOutcome.DELETED;
    }

    private Consumer require(String op, String ref) {
        Consumer consumer = resolve(ref);
        if (consumer == null) {
            throw new RegistryException(RegistryErrorKind.NOT_FOUND, op, 404, "consumer '" + ref + "' not found", null);
        }
        return consumer;
    }

    private Consumer resolve(String ref) {
        if (ref == null) return null;
        Consumer byId = consumersById.get(ref);
        if (byId != null) return byId;
        String id = consumerIdsByUsername.get(ref);
        return id == null ? null : consumersById.get(id);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
