package com.contact.identity.cdi;

import com.contact.identity.api.ContactIdentifier;
import com.contact.identity.api.IdentityOptions;
import com.contact.identity.lock.LocalDistributedLock;
import com.contact.identity.lock.LockConfig;
import com.contact.identity.metrics.MicrometerMetricsService;
import com.contact.identity.store.StoreConfig;
import com.contact.identity.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * CDI producer that wires the contact identity service from MicroProfile Config.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}; override
 * any key through system properties or environment variables:</p>
 * <pre>
 * contact-identity.datasource.url=jdbc:postgresql://db:5432/contacts
 * contact-identity.identify.max-attempts=5
 * </pre>
 *
 * <p>Metrics and tracing are wired only when enabled and a {@link MeterRegistry}
 * or {@link Tracer} bean is available in the container.</p>
 */
@ApplicationScoped
public class ContactIdentityProducer {

    private static final Logger log = LoggerFactory.getLogger(ContactIdentityProducer.class);

    // ── Data source ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-identity.datasource.url", defaultValue = "jdbc:postgresql://localhost:5432/contacts")
    String datasourceUrl;

    @Inject
    @ConfigProperty(name = "contact-identity.datasource.username", defaultValue = "postgres")
    String datasourceUsername;

    @Inject
    @ConfigProperty(name = "contact-identity.datasource.password", defaultValue = "")
    String datasourcePassword;

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-identity.store.query-timeout-seconds", defaultValue = "10")
    int queryTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "contact-identity.store.initialize-schema", defaultValue = "true")
    boolean initializeSchema;

    // ── Locking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-identity.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    // ── Identify ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-identity.identify.max-attempts", defaultValue = "3")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = "contact-identity.identify.retry-delay-ms", defaultValue = "50")
    long retryDelayMs;

    @Inject
    @ConfigProperty(name = "contact-identity.identify.source-system", defaultValue = "IDENTIFY_API")
    String sourceSystem;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-identity.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "contact-identity.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ContactIdentifier contactIdentifier() {
        log.info("Producing ContactIdentifier: datasource={}", datasourceUrl);

        StoreConfig storeConfig = StoreConfig.builder()
                .queryTimeoutSeconds(queryTimeoutSeconds)
                .initializeSchema(initializeSchema)
                .build();

        IdentityOptions options = IdentityOptions.builder()
                .maxAttempts(maxAttempts)
                .retryDelayMs(retryDelayMs)
                .sourceSystem(sourceSystem)
                .build();

        ContactIdentifier.Builder builder = ContactIdentifier.builder()
                .dataSource(dataSource(), storeConfig)
                .distributedLock(new LocalDistributedLock(new LockConfig(lockTimeoutMs)))
                .options(options);

        if (metricsEnabled && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Metrics enabled");
        } else if (metricsEnabled) {
            log.warn("Metrics enabled but no MeterRegistry bean is available; metrics disabled");
        }

        if (tracingEnabled && tracer.isResolvable()) {
            builder.tracingService(new OpenTelemetryTracingService(tracer.get()));
            log.info("Tracing enabled");
        } else if (tracingEnabled) {
            log.warn("Tracing enabled but no Tracer bean is available; tracing disabled");
        }

        return builder.build();
    }

    public void closeIdentifier(@Disposes ContactIdentifier identifier) {
        log.info("Closing ContactIdentifier");
        identifier.close();
    }

    private DataSource dataSource() {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(datasourceUrl);
        dataSource.setUser(datasourceUsername);
        dataSource.setPassword(datasourcePassword);
        return dataSource;
    }
}
