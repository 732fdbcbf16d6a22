package com.contact.identity.chaos;

import com.contact.identity.api.ContactIdentifier;
import com.contact.identity.api.IdentifyRequest;
import com.contact.identity.api.IdentifyResult;
import com.contact.identity.api.IdentityOptions;
import com.contact.identity.audit.AuditAction;
import com.contact.identity.core.model.Contact;
import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.health.HealthStatus;
import com.contact.identity.metrics.MicrometerMetricsService;
import com.contact.identity.store.InMemoryContactStore;
import com.contact.identity.store.StoreTimeoutException;
import com.contact.identity.store.StoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resilience of identify against store failures, using an in-memory store
 * wrapped in {@link FailingContactStore}.
 */
class ChaosTest {

    private InMemoryContactStore baseStore;
    private FailingContactStore chaosStore;
    private SimpleMeterRegistry registry;
    private ContactIdentifier identifier;

    @BeforeEach
    void setUp() {
        baseStore = new InMemoryContactStore();
        chaosStore = new FailingContactStore(baseStore);
        registry = new SimpleMeterRegistry();
        identifier = ContactIdentifier.builder()
                .store(chaosStore)
                .metricsService(new MicrometerMetricsService(registry))
                .options(IdentityOptions.builder().maxAttempts(3).retryDelayMs(0).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        identifier.close();
    }

    @Test
    @DisplayName("A timed-out transaction is retried from the start")
    void retriesTimeout() {
        chaosStore.timeOutNextTransactions(1);

        IdentifyResult result = identifier.identify(IdentifyRequest.of("a@x.com", "111"));

        assertEquals(IdentifyOutcome.NEW_PRIMARY, result.outcome());
        assertEquals(2, chaosStore.getTransactionCount());
        assertEquals(1, baseStore.size());
        assertEquals(1.0, registry.get("contact.identify.retried").counter().count());
    }

    @Test
    @DisplayName("Retries stop at maxAttempts")
    void retriesExhausted() {
        chaosStore.timeOutNextTransactions(10);

        assertThrows(StoreTimeoutException.class,
                () -> identifier.identify(IdentifyRequest.of("a@x.com", "111")));
        assertEquals(3, chaosStore.getTransactionCount());
        assertEquals(0, baseStore.size());
        assertEquals(1.0, registry.get("contact.identify.failed")
                .tag("error", "StoreTimeoutException").counter().count());
    }

    @Test
    @DisplayName("Non-retryable failures surface immediately and audit nothing")
    void noRetryOnUnavailable() {
        chaosStore.setFailOnCreate(true);

        assertThrows(StoreUnavailableException.class,
                () -> identifier.identify(IdentifyRequest.of("a@x.com", "111")));
        assertEquals(1, chaosStore.getTransactionCount());
        assertEquals(0, baseStore.size());
        assertEquals(0, identifier.getAuditService().size());
    }

    @Test
    @DisplayName("A merge failing half-way leaves every row as it was")
    void mergeRollsBack() {
        identifier.identify(IdentifyRequest.of("a@x.com", "111"));
        identifier.identify(IdentifyRequest.of("b@x.com", "222"));
        identifier.identify(IdentifyRequest.of("c@x.com", "222"));
        List<Contact> before = baseStore.findAll();
        int auditBefore = identifier.getAuditService().size();
        chaosStore.setFailOnRelink(true);

        assertThrows(StoreUnavailableException.class,
                () -> identifier.identify(IdentifyRequest.of("a@x.com", "222")));

        List<Contact> after = baseStore.findAll();
        assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++) {
            assertEquals(before.get(i).getLinkPrecedence(), after.get(i).getLinkPrecedence());
            assertEquals(before.get(i).getLinkedId(), after.get(i).getLinkedId());
            assertEquals(before.get(i).getUpdatedAt(), after.get(i).getUpdatedAt());
        }
        assertEquals(auditBefore, identifier.getAuditService().size());
        assertTrue(identifier.getAuditService().getEntriesByAction(AuditAction.PRIMARY_DEMOTED).isEmpty());
    }

    @Test
    @DisplayName("Identify works again once the store recovers")
    void recovers() {
        chaosStore.setFailOnCreate(true);
        assertThrows(StoreUnavailableException.class,
                () -> identifier.identify(IdentifyRequest.ofEmail("a@x.com")));

        chaosStore.setFailOnCreate(false);
        IdentifyResult result = identifier.identify(IdentifyRequest.ofEmail("a@x.com"));

        assertEquals(IdentifyOutcome.NEW_PRIMARY, result.outcome());
    }

    @Test
    @DisplayName("Health reports DOWN while the store is unreachable")
    void healthDown() {
        chaosStore.setFailOnPing(true);
        HealthStatus down = identifier.health();
        assertTrue(down.isDown());

        chaosStore.setFailOnPing(false);
        assertFalse(identifier.health().isDown());
    }
}
