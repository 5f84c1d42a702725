package com.m2m.gateway.credential.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

import com.m2m.gateway.credential.DeleteOutcome;
import com.m2m.gateway.credential.InMemoryRegistryClient;
import com.m2m.gateway.credential.RegistryClient;
import com.m2m.gateway.credential.RegistryErrorKind;
import com.m2m.gateway.credential.RegistryException;
import com.m2m.gateway.credential.model.Consumer;
import com.m2m.gateway.credential.model.NamedCredential;
import com.m2m.gateway.credential.server.key.CredentialSecrets;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LifecycleManager")
class LifecycleManagerTest {

    private Instant now;
    private InMemoryRegistryClient registry;
    private LifecycleManager manager;

    @BeforeEach
    void setUp() {
        now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        registry = new InMemoryRegistryClient();
        manager = newManager(registry);
    }

    private LifecycleManager newManager(RegistryClient client) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        IdentityMapper mapper = new IdentityMapper();
        LifecycleConfig config = new LifecycleConfig();
        return new LifecycleManager(
            client,
            new CredentialIssuer(client, mapper, config.getNameAttempts(), clock),
            new HmacTokenMinter(config.getKeyClaimName(), config.getDefaultTokenTtl(), config.getMaxTokenTtl(), clock),
            mapper,
            clock);
    }

    private NamedCredential storedCredential(String principal, String name) {
        Consumer consumer = registry.getConsumer(principal).orElseThrow();
        return registry.listCredentials(consumer.ref()).stream()
            .filter(c -> c.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no stored credential named " + name));
    }

    private static Claims verify(String token, NamedCredential credential) {
        return Jwts.parser()
            .verifyWith(Keys.hmacShaKeyFor(CredentialSecrets.decode(credential.secret())))
            .build()
            .parseSignedClaims(token)
            .getPayload();
    }

    @Nested
    @DisplayName("issueForPrincipal")
    class IssueForPrincipal {

        @Test
        @DisplayName("same name twice: the second token carries the renamed key")
        void aliceLaptopTwice() {
            LifecycleManager.IssuedCredential first = manager.issueForPrincipal("alice", "laptop");

            assertThat(first.finalName()).isEqualTo("laptop");
            assertThat(first.renamed()).isFalse();
            assertThat(first.consumerCreated()).isTrue();
            assertThat(verify(first.token(), storedCredential("alice", "laptop")).get("kid", String.class))
                .isEqualTo("laptop");

            LifecycleManager.IssuedCredential second = manager.issueForPrincipal("alice", "laptop");

            assertThat(second.renamed()).isTrue();
            assertThat(second.consumerCreated()).isFalse();
            assertThat(second.finalName()).matches("laptop_\\d{6}_[0-9a-f]{8}");
            Claims claims = verify(second.token(), storedCredential("alice", second.finalName()));
            assertThat(claims.get("kid", String.class)).isEqualTo(second.finalName());
            assertThat(claims.getSubject()).isEqualTo("alice");
            assertThat(second.consumerId()).isEqualTo(first.consumerId());
        }

        @Test
        @DisplayName("name taken by another principal still yields a verifiable token")
        void collisionAcrossPrincipals() {
            manager.issueForPrincipal("bob", "x");

            LifecycleManager.IssuedCredential issued = manager.issueForPrincipal("alice", "x");

            assertThat(issued.finalName()).isNotEqualTo("x");
            NamedCredential stored = storedCredential("alice", issued.finalName());
            assertThat(stored.id()).isEqualTo(issued.credentialId());
            assertThat(verify(issued.token(), stored).get("kid", String.class)).isEqualTo(issued.finalName());
        }

        @Test
        @DisplayName("absent name defaults to <principal>_token_<timestamp>")
        void defaultName() {
            String stamp = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC).format(now);

            LifecycleManager.IssuedCredential issued = manager.issueForPrincipal("alice", null);

            assertThat(issued.requestedName()).isEqualTo("alice_token_" + stamp);
            assertThat(issued.finalName()).isEqualTo(issued.requestedName());
        }

        @Test
        @DisplayName("reports the consumer key and expiry")
        void bookkeeping() {
            LifecycleManager.IssuedCredential issued = manager.issueForPrincipal("alice", "laptop", Duration.ofHours(1));

            assertThat(issued.consumerKey()).isEqualTo(new IdentityMapper().resolve("alice").toString());
            assertThat(issued.expiresAt()).isEqualTo(now.plus(Duration.ofHours(1)));
            assertThat(registry.getConsumer("alice")).map(Consumer::customId).contains(issued.consumerKey());
            assertThat(issued.toString()).doesNotContain(issued.token());
        }

        @Test
        @DisplayName("autoProvision uses the auto prefix")
        void autoProvision() {
            LifecycleManager.IssuedCredential issued = manager.autoProvision("alice");

            assertThat(issued.finalName()).startsWith("alice_auto_");
            assertThat(issued.consumerCreated()).isTrue();
        }

        @Test
        @DisplayName("blank principal is rejected")
        void blankPrincipal() {
            assertThatThrownBy(() -> manager.issueForPrincipal(" ", "laptop"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("registry outage propagates with its classification")
        void unavailablePropagates() {
            RegistryClient down = mock(RegistryClient.class);
            RegistryException refused = new RegistryException(RegistryErrorKind.UNAVAILABLE, "createConsumer", "refused", null);
            when(down.createConsumer("alice", new IdentityMapper().resolve("alice").toString())).thenThrow(refused);

            assertThatThrownBy(() -> newManager(down).issueForPrincipal("alice", "laptop")).isSameAs(refused);
        }
    }

    @Nested
    @DisplayName("listTokens")
    class ListTokens {

        @Test
        @DisplayName("lists metadata without secrets")
        void noSecrets() {
            manager.issueForPrincipal("alice", "laptop");
            manager.issueForPrincipal("alice", "phone");
            Consumer alice = registry.getConsumer("alice").orElseThrow();
            List<String> secrets = registry.listCredentials(alice.ref()).stream().map(NamedCredential::secret).toList();

            List<LifecycleManager.TokenSummary> tokens = manager.listTokens("alice");

            assertThat(tokens).extracting(LifecycleManager.TokenSummary::name).containsExactlyInAnyOrder("laptop", "phone");
            assertThat(tokens).allSatisfy(t -> {
                assertThat(t.consumerId()).isEqualTo(alice.id());
                assertThat(t.algorithm()).isEqualTo("HS256");
                assertThat(t.createdAt()).isNotNull();
                assertThat(t.displayId()).contains("...").hasSizeLessThan(t.id().length());
                assertThat(secrets).noneMatch(s -> t.toString().contains(s));
            });
        }

        @Test
        @DisplayName("unknown principal has no tokens")
        void unknownPrincipal() {
            assertThat(manager.listTokens("nobody")).isEmpty();
        }
    }

    @Nested
    @DisplayName("deletion")
    class Deletion {

        @Test
        @DisplayName("deleteByName removes only the principal's credential")
        void deleteByNameIsScoped() {
            manager.issueForPrincipal("bob", "x");
            LifecycleManager.IssuedCredential aliceX = manager.issueForPrincipal("alice", "x");

            assertThat(manager.deleteByName("alice", "x")).isEqualTo(DeleteOutcome.NOT_FOUND);
            assertThat(manager.listTokens("bob")).extracting(LifecycleManager.TokenSummary::name).containsExactly("x");

            assertThat(manager.deleteByName("alice", aliceX.finalName())).isEqualTo(DeleteOutcome.DELETED);
            assertThat(manager.listTokens("alice")).isEmpty();
            assertThat(manager.listTokens("bob")).hasSize(1);
        }

        @Test
        @DisplayName("deleteById refuses another principal's credential")
        void deleteByIdChecksOwnership() {
            LifecycleManager.IssuedCredential bobs = manager.issueForPrincipal("bob", "tablet");
            manager.issueForPrincipal("alice", "laptop");

            assertThat(manager.deleteById("alice", bobs.credentialId())).isEqualTo(DeleteOutcome.NOT_FOUND);
            assertThat(manager.deleteById("bob", bobs.credentialId())).isEqualTo(DeleteOutcome.DELETED);
            assertThat(manager.deleteById("bob", bobs.credentialId())).isEqualTo(DeleteOutcome.NOT_FOUND);
        }

        @Test
        @DisplayName("deletes for a principal without consumer are NOT_FOUND")
        void noConsumer() {
            assertThat(manager.deleteById("nobody", "j-1")).isEqualTo(DeleteOutcome.NOT_FOUND);
            assertThat(manager.deleteByName("nobody", "laptop")).isEqualTo(DeleteOutcome.NOT_FOUND);
        }

        @Test
        @DisplayName("a deleted name can be issued again without rename")
        void nameReusableAfterDelete() {
            manager.issueForPrincipal("alice", "laptop");
            manager.deleteByName("alice", "laptop");

            assertThat(manager.issueForPrincipal("alice", "laptop").finalName()).isEqualTo("laptop");
        }
    }

    @Nested
    @DisplayName("administration")
    class Administration {

        @Test
        @DisplayName("lists and removes consumers")
        void consumers() {
            manager.issueForPrincipal("alice", "laptop");
            manager.issueForPrincipal("bob", "phone");

            assertThat(manager.listConsumers()).extracting(Consumer::username).containsExactly("alice", "bob");
            assertThat(manager.deleteConsumer("alice")).isEqualTo(DeleteOutcome.DELETED);
            assertThat(manager.listTokens("alice")).isEmpty();
            assertThat(manager.deleteConsumer("alice")).isEqualTo(DeleteOutcome.NOT_FOUND);
        }

        @Test
        @DisplayName("create wires a manager from configuration")
        void createFromConfig() {
            LifecycleConfig config = new LifecycleConfig();
            config.setKeyClaimName("iss");
            LifecycleManager configured = LifecycleManager.create(registry, config);

            LifecycleManager.IssuedCredential issued = configured.issueForPrincipal("alice", "laptop");

            Claims claims = verify(issued.token(), storedCredential("alice", "laptop"));
            assertThat(claims.getIssuer()).isEqualTo("laptop");
        }
    }
}
