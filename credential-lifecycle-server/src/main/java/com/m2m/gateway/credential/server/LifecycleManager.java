package com.m2m.gateway.credential.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

import com.m2m.gateway.credential.DeleteOutcome;
import com.m2m.gateway.credential.RegistryClient;
import com.m2m.gateway.credential.model.Consumer;
import com.m2m.gateway.credential.model.NamedCredential;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Public operations for gateway credentials: issue a credential with its token, list a
 * principal's credentials, and revoke them by id or by name.
 * <p>
 * Nothing is cached; every call re-reads the registry. The principal is trusted as already
 * authenticated and authorized by the caller.
 */
@Slf4j
@AllArgsConstructor
public class LifecycleManager {

    private static final DateTimeFormatter NAME_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    public record IssuedCredential(
        String token,
        Instant expiresAt,
        String finalName,
        String requestedName,
        String credentialId,
        String consumerId,
        String consumerKey,
        boolean consumerCreated
    ) {
        public boolean renamed() {
            return !finalName.equals(requestedName);
        }

        @Override
        public String toString() {
            return "IssuedCredential[finalName=" + finalName + ", requestedName=" + requestedName
                + ", credentialId=" + credentialId + ", consumerId=" + consumerId
                + ", consumerCreated=" + consumerCreated + ", expiresAt=" + expiresAt + "]";
        }
    }

    public record TokenSummary(
        String id,
        String displayId,
        String name,
        String algorithm,
        Instant createdAt,
        String consumerId
    ) {
        static TokenSummary of(NamedCredential credential) {
            return new TokenSummary(
                credential.id(),
                truncate(credential.id()),
                credential.name(),
                credential.algorithm(),
                credential.createdAt() == null ? null : Instant.ofEpochSecond(credential.createdAt()),
                credential.consumerId());
        }

        private static String truncate(String id) {
            return id.length() > 12 ? id.substring(0, 8) + "..." + id.substring(id.length() - 4) : id;
        }
    }

    private final RegistryClient registry;
    private final CredentialIssuer issuer;
    private final TokenMinter minter;
    private final IdentityMapper identityMapper;
    private final Clock clock;

    public static LifecycleManager create(RegistryClient registry, LifecycleConfig config) {
        config.validate();
        IdentityMapper identityMapper = new IdentityMapper();
        return new LifecycleManager(
            registry,
            new CredentialIssuer(registry, identityMapper, config),
            new HmacTokenMinter(config),
            identityMapper,
            Clock.systemUTC());
    }

    public IssuedCredential issueForPrincipal(String principal, String requestedName) {
        return issueForPrincipal(principal, requestedName, null);
    }

    /**
     * Ensures the principal's consumer, creates a credential (renamed on collision) and
     * mints a token whose key claim is the credential's final name.
     *
     * @param requestedName credential name; blank for {@code <principal>_token_<yyyyMMdd>_<HHmmss>}
     * @param ttl token lifetime; {@code null} for the configured default
     */
    public IssuedCredential issueForPrincipal(String principal, String requestedName, Duration ttl) {
        requirePrincipal(principal);
        String name = (requestedName == null || requestedName.isBlank())
            ? defaultName(principal, "token")
            : requestedName.trim();
        return issue(principal, name, ttl);
    }

    /**
     * Provisions the consumer and a credential named {@code <principal>_auto_<timestamp>}.
     */
    public IssuedCredential autoProvision(String principal) {
        requirePrincipal(principal);
        return issue(principal, defaultName(principal, "auto"), null);
    }

    public List<TokenSummary> listTokens(String principal) {
        requirePrincipal(principal);
        Optional<Consumer> consumer = registry.getConsumer(principal);
        if (consumer.isEmpty()) {
            log.debug("No consumer for principal {}, no tokens", principal);
            return List.of();
        }
        return registry.listCredentials(consumer.get().ref()).stream()
            .map(TokenSummary::of)
            .toList();
    }

    public DeleteOutcome deleteById(String principal, String credentialId) {
        requirePrincipal(principal);
        if (credentialId == null || credentialId.isBlank()) return DeleteOutcome.NOT_FOUND;

        Optional<Consumer> consumer = registry.getConsumer(principal);
        if (consumer.isEmpty()) return DeleteOutcome.NOT_FOUND;

        boolean owned = registry.listCredentials(consumer.get().ref()).stream()
            .anyMatch(c -> c.id().equals(credentialId));
        if (!owned) {
            log.info("Credential {} not found for principal {}", credentialId, principal);
            return DeleteOutcome.NOT_FOUND;
        }
        return delete(principal, consumer.get(), credentialId);
    }

    public DeleteOutcome deleteByName(String principal, String name) {
        requirePrincipal(principal);
        if (name == null || name.isBlank()) return DeleteOutcome.NOT_FOUND;

        Optional<Consumer> consumer = registry.getConsumer(principal);
        if (consumer.isEmpty()) return DeleteOutcome.NOT_FOUND;

        Optional<NamedCredential> match = registry.listCredentials(consumer.get().ref()).stream()
            .filter(c -> c.name().equals(name))
            .findFirst();
        if (match.isEmpty()) {
            log.info("Credential named '{}' not found for principal {}", name, principal);
            return DeleteOutcome.NOT_FOUND;
        }
        return delete(principal, consumer.get(), match.get().id());
    }

    public List<Consumer> listConsumers() {
        List<Consumer> consumers = registry.listConsumers();
        log.debug("Registry holds {} consumers", consumers.size());
        return consumers;
    }

    /**
     * Administrative removal of a principal's consumer together with its credentials.
     */
    public DeleteOutcome deleteConsumer(String principal) {
        requirePrincipal(principal);
        DeleteOutcome outcome = registry.deleteConsumer(principal);
        log.info("Delete consumer for principal {}: {}", principal, outcome);
        return outcome;
    }

    private IssuedCredential issue(String principal, String name, Duration ttl) {
        log.info("Issuing credential for principal {}, requested name '{}'", principal, name);

        CredentialIssuer.ProvisionedConsumer provisioned = issuer.ensureConsumer(principal);
        CredentialIssuer.IssuedName issued = issuer.issueCredential(provisioned.consumer(), name);
        TokenMinter.MintedToken minted = minter.mint(principal, issued.credential(), ttl);

        return new IssuedCredential(
            minted.token(),
            minted.claims().expiresAt(),
            minted.claims().keyId(),
            name,
            issued.credential().id(),
            provisioned.consumer().id(),
            identityMapper.resolve(principal).toString(),
            provisioned.created());
    }

    private DeleteOutcome delete(String principal, Consumer consumer, String credentialId) {
        DeleteOutcome outcome = registry.deleteCredential(consumer.ref(), credentialId);
        log.info("Delete credential {} for principal {}: {}", credentialId, principal, outcome);
        return outcome;
    }

    String defaultName(String principal, String prefix) {
        return principal + "_" + prefix + "_" + NAME_TIMESTAMP.format(clock.instant());
    }

    private static void requirePrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("principal must not be blank");
        }
    }
}
