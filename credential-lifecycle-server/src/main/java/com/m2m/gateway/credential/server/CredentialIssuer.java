package com.m2m.gateway.credential.server;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.m2m.gateway.credential.RegistryClient;
import com.m2m.gateway.credential.RegistryErrorKind;
import com.m2m.gateway.credential.RegistryException;
import com.m2m.gateway.credential.model.Consumer;
import com.m2m.gateway.credential.model.NamedCredential;
import com.m2m.gateway.credential.server.key.CredentialSecrets;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Provisions consumers and creates uniquely named credentials under them.
 * <p>
 * Consumer creation is get-or-create: a username conflict means another request (or
 * instance) won the race, and its record is used. Credential names are unique across the
 * whole registry, so a conflicting name is replaced by
 * {@code <requested>_<HHmmss>_<8 hex>} and retried with a fresh secret, up to
 * {@code nameAttempts} creates in total. The name of the credential the registry returns
 * is the only source for the final name.
 */
@Slf4j
@AllArgsConstructor
public class CredentialIssuer {

    private static final DateTimeFormatter SUFFIX_TIME = DateTimeFormatter.ofPattern("HHmmss").withZone(ZoneOffset.UTC);

    public record ProvisionedConsumer(Consumer consumer, boolean created) {}

    public record IssuedName(NamedCredential credential, String requestedName) {
        public String finalName() {
            return credential.name();
        }

        public boolean renamed() {
            return !credential.name().equals(requestedName);
        }
    }

    sealed interface Attempt {
        record Issued(NamedCredential credential) implements Attempt {}
        record Exhausted(List<String> triedNames) implements Attempt {}
    }

    private final RegistryClient registry;
    private final IdentityMapper identityMapper;
    private final int nameAttempts;
    private final Clock clock;

    public CredentialIssuer(RegistryClient registry, IdentityMapper identityMapper, LifecycleConfig config) {
        this(registry, identityMapper, config.getNameAttempts(), Clock.systemUTC());
    }

    public ProvisionedConsumer ensureConsumer(String principal) {
        String consumerKey = identityMapper.resolve(principal).toString();
        try {
            Consumer created = registry.createConsumer(principal, consumerKey);
            log.info("Created consumer {} for principal {}", created.id(), principal);
            return new ProvisionedConsumer(created, true);
        } catch (RegistryException e) {
            if (!e.is(RegistryErrorKind.CONFLICT)) throw e;
            log.debug("Consumer for principal {} already exists, fetching it", principal);
            Consumer existing = registry.getConsumer(principal).orElseThrow(() -> e);
            return new ProvisionedConsumer(existing, false);
        }
    }

    public IssuedName issueCredential(Consumer consumer, String requestedName) {
        if (requestedName == null || requestedName.isBlank()) {
            throw new IllegalArgumentException("requestedName must not be blank");
        }

        Attempt outcome = createWithRenames(consumer, requestedName);
        if (outcome instanceof Attempt.Exhausted exhausted) {
            log.error("Credential name '{}' exhausted after {} attempts for consumer {}",
                requestedName, exhausted.triedNames().size(), consumer.id());
            throw new NameExhaustedException(requestedName, exhausted.triedNames());
        }

        IssuedName issued = new IssuedName(((Attempt.Issued) outcome).credential(), requestedName);
        if (issued.renamed()) {
            log.warn("Credential name '{}' was taken, issued as '{}' for consumer {}",
                requestedName, issued.finalName(), consumer.id());
        } else {
            log.info("Issued credential '{}' for consumer {}", issued.finalName(), consumer.id());
        }
        return issued;
    }

    private Attempt createWithRenames(Consumer consumer, String requestedName) {
        List<String> tried = new ArrayList<>(nameAttempts);
        String candidate = requestedName;
        for (int attempt = 1; attempt <= nameAttempts; attempt++) {
            try {
                NamedCredential credential = registry.createCredential(consumer.ref(), candidate, CredentialSecrets.newSecret());
                return new Attempt.Issued(credential);
            } catch (RegistryException e) {
                if (!e.is(RegistryErrorKind.CONFLICT)) throw e;
                tried.add(candidate);
                log.debug("Credential name '{}' conflicts (attempt {}/{})", candidate, attempt, nameAttempts);
                candidate = uniqueName(requestedName);
            }
        }
        return new Attempt.Exhausted(tried);
    }

    String uniqueName(String requestedName) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return requestedName + "_" + SUFFIX_TIME.format(clock.instant()) + "_" + suffix;
    }
}
