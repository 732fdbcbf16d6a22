package com.contact.identity.api;

import com.contact.identity.audit.AuditRepository;
import com.contact.identity.audit.AuditService;
import com.contact.identity.health.ContactStoreHealthCheck;
import com.contact.identity.health.HealthCheck;
import com.contact.identity.health.HealthCheckRegistry;
import com.contact.identity.health.HealthStatus;
import com.contact.identity.health.MemoryHealthCheck;
import com.contact.identity.lock.DistributedLock;
import com.contact.identity.lock.LocalDistributedLock;
import com.contact.identity.metrics.MetricsService;
import com.contact.identity.metrics.NoOpMetricsService;
import com.contact.identity.store.ContactStore;
import com.contact.identity.store.JdbcContactStore;
import com.contact.identity.store.StoreConfig;
import com.contact.identity.tracing.NoOpTracingService;
import com.contact.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point: wires a {@link ContactStore} with locking, audit, metrics
 * and tracing into a {@link ContactIdentityService}.
 *
 * <pre>
 * ContactIdentifier identifier = ContactIdentifier.builder()
 *     .dataSource(dataSource, StoreConfig.defaults())
 *     .build();
 *
 * IdentifyResult result = identifier.identify(IdentifyRequest.of("a@x.com", "111"));
 * long primaryId = result.contact().primaryContactId();
 * </pre>
 */
public class ContactIdentifier implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContactIdentifier.class);

    private final ContactStore store;
    private final boolean ownsStore;
    private final ContactIdentityService service;
    private final AuditService auditService;
    private final HealthCheckRegistry healthCheckRegistry;

    private ContactIdentifier(Builder builder) {
        if (builder.store != null) {
            this.store = builder.store;
            this.ownsStore = false;
        } else {
            this.store = new JdbcContactStore(builder.dataSource, builder.storeConfig);
            this.ownsStore = true;
        }

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        DistributedLock lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        this.service = new ContactIdentityService(
                store, lock, auditService, metricsService, tracingService, builder.options);

        this.healthCheckRegistry = new HealthCheckRegistry()
                .register(new ContactStoreHealthCheck(store))
                .register(new MemoryHealthCheck());
        builder.healthChecks.forEach(healthCheckRegistry::register);

        log.info("ContactIdentifier initialized with store: {} options: {}", store.getName(), builder.options);
    }

    public IdentifyResult identify(IdentifyRequest request) {
        return service.identify(request);
    }

    public Optional<ContactSummary> lookup(long contactId) {
        return service.lookup(contactId);
    }

    /**
     * Aggregate status of the store, memory and any extra registered checks.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public ContactIdentityService getService() {
        return service;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ContactStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownsStore) {
            try {
                store.close();
            } catch (RuntimeException e) {
                log.warn("Error closing contact store", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ContactStore store;
        private DataSource dataSource;
        private StoreConfig storeConfig = StoreConfig.defaults();
        private DistributedLock distributedLock;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private TracingService tracingService;
        private IdentityOptions options = IdentityOptions.defaults();
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        /**
         * Uses an existing store; the caller keeps ownership of it.
         */
        public Builder store(ContactStore store) {
            this.store = store;
            return this;
        }

        /**
         * Uses a {@link JdbcContactStore} over the data source; closed with the identifier.
         */
        public Builder dataSource(DataSource dataSource, StoreConfig storeConfig) {
            this.dataSource = dataSource;
            this.storeConfig = storeConfig;
            return this;
        }

        /**
         * Defaults to {@link LocalDistributedLock}.
         */
        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Ignored when an {@link AuditService} is set.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder options(IdentityOptions options) {
            this.options = options;
            return this;
        }

        public Builder healthCheck(HealthCheck check) {
            this.healthChecks.add(check);
            return this;
        }

        public ContactIdentifier build() {
            if (store == null && dataSource == null) {
                throw new IllegalStateException("A ContactStore or a DataSource is required");
            }
            if (store != null && dataSource != null) {
                throw new IllegalStateException("Set either a ContactStore or a DataSource, not both");
            }
            return new ContactIdentifier(this);
        }
    }
}
