package com.m2m.gateway.credential;

import java.util.List;
import java.util.Optional;

import com.m2m.gateway.credential.model.Consumer;
import com.m2m.gateway.credential.model.NamedCredential;

/**
 * Consumer and JWT credential operations against the gateway registry.
 * Each call is one round trip; every failure is a {@link RegistryException}.
 */
public interface RegistryClient {

    /**
     * @throws RegistryException with {@link RegistryErrorKind#CONFLICT} if the username exists
     */
    Consumer createConsumer(String username, String customId);

    Optional<Consumer> getConsumer(String usernameOrId);

    /**
     * @param secret base64 encoded signing secret
     * @throws RegistryException with {@link RegistryErrorKind#CONFLICT} if the name exists anywhere in the registry
     */
    NamedCredential createCredential(String consumerRef, String name, String secret);

    List<NamedCredential> listCredentials(String consumerRef);

    DeleteOutcome deleteCredential(String consumerRef, String credentialId);

    List<Consumer> listConsumers();

    DeleteOutcome deleteConsumer(String usernameOrId);
}
