package com.contact.identity.api;

import com.contact.identity.audit.AuditAction;
import com.contact.identity.audit.AuditService;
import com.contact.identity.core.model.Contact;
import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.lock.DistributedLock;
import com.contact.identity.lock.IdentifierLocks;
import com.contact.identity.logging.LogContext;
import com.contact.identity.match.ContactMatcher;
import com.contact.identity.merge.ClusterContentionException;
import com.contact.identity.merge.ClusterMerge;
import com.contact.identity.merge.ClusterResolver;
import com.contact.identity.merge.InconsistentStateException;
import com.contact.identity.merge.ResolvedCluster;
import com.contact.identity.metrics.MetricsService;
import com.contact.identity.store.ContactCriteria;
import com.contact.identity.store.ContactStore;
import com.contact.identity.store.ContactTransaction;
import com.contact.identity.store.NewContact;
import com.contact.identity.store.StoreException;
import com.contact.identity.store.StoreUnavailableException;
import com.contact.identity.tracing.Span;
import com.contact.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles submitted identifiers against stored contacts.
 *
 * <p>One {@link #identify} call runs matching, cluster resolution, the
 * conditional create and response assembly inside a single store transaction,
 * while holding the identifier locks of the request. A transient failure
 * re-runs the whole reconciliation; no individual step is ever retried.
 * Audit entries, metrics and the trace outcome are recorded only once the
 * transaction has committed.</p>
 */
public class ContactIdentityService {
    private static final Logger log = LoggerFactory.getLogger(ContactIdentityService.class);

    private final ContactStore store;
    private final ContactMatcher matcher;
    private final ClusterResolver clusterResolver;
    private final SecondaryContactPolicy secondaryPolicy;
    private final ContactResponseBuilder responseBuilder;
    private final DistributedLock distributedLock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final IdentityOptions options;

    public ContactIdentityService(ContactStore store,
                                  DistributedLock distributedLock,
                                  AuditService auditService,
                                  MetricsService metricsService,
                                  TracingService tracingService,
                                  IdentityOptions options) {
        this(store, new ContactMatcher(), new ClusterResolver(), new SecondaryContactPolicy(),
                new ContactResponseBuilder(), distributedLock, auditService, metricsService,
                tracingService, options);
    }

    public ContactIdentityService(ContactStore store,
                                  ContactMatcher matcher,
                                  ClusterResolver clusterResolver,
                                  SecondaryContactPolicy secondaryPolicy,
                                  ContactResponseBuilder responseBuilder,
                                  DistributedLock distributedLock,
                                  AuditService auditService,
                                  MetricsService metricsService,
                                  TracingService tracingService,
                                  IdentityOptions options) {
        this.store = store;
        this.matcher = matcher;
        this.clusterResolver = clusterResolver;
        this.secondaryPolicy = secondaryPolicy;
        this.responseBuilder = responseBuilder;
        this.distributedLock = distributedLock;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.options = options;
    }

    /**
     * Reconciles the request and returns the consolidated cluster.
     *
     * @throws InvalidRequestException     if neither identifier is present
     * @throws StoreException              if the store fails, after retries where retryable
     * @throws InconsistentStateException  if the stored clusters violate their invariants
     * @throws ClusterContentionException  if concurrent merges kept moving the cluster roots
     */
    public IdentifyResult identify(IdentifyRequest request) {
        request.validate();
        long startNanos = System.nanoTime();

        try (LogContext ignored = LogContext.forIdentify(LogContext.generateCorrelationId());
             Span span = tracingService.startSpan("contact.identify", Map.of(
                     "hasEmail", String.valueOf(request.email().isPresent()),
                     "hasPhoneNumber", String.valueOf(request.phoneNumber().isPresent())))) {
            try {
                IdentifyResult result = identifyWithRetry(request);
                Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                recordCommitted(result, duration);

                span.setAttribute("primaryContactId", result.contact().primaryContactId());
                span.setAttribute("outcome", result.outcome().name());
                span.setStatus(Span.SpanStatus.OK);
                log.info("identify.completed primaryContactId={} outcome={} clusterSize={} durationMs={}",
                        result.contact().primaryContactId(), result.outcome(),
                        result.contact().clusterSize(), duration.toMillis());
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                metricsService.incrementIdentifyFailed(e.getClass().getSimpleName());
                log.error("identify.failed error={} message={}", e.getClass().getSimpleName(), e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Returns the cluster containing a contact without modifying anything.
     *
     * @return empty if no non-deleted contact has that id
     */
    public Optional<ContactSummary> lookup(long contactId) {
        try (LogContext ignored = LogContext.forLookup(LogContext.generateCorrelationId(), contactId)) {
            return store.inTransaction(tx -> {
                List<Contact> found = tx.findContacts(ContactCriteria.anyOf().ids(List.of(contactId)).build());
                if (found.isEmpty()) {
                    return Optional.empty();
                }
                long rootId = found.get(0).clusterRootId();
                List<Contact> members = tx.findContacts(ContactCriteria.clusterMembers(List.of(rootId)));
                Contact primary = members.stream()
                        .filter(c -> c.getId() == rootId && c.isPrimary())
                        .findFirst()
                        .orElseThrow(() -> {
                            log.error("lookup.inconsistent contactId={} rootId={} reason=no-primary", contactId, rootId);
                            return new InconsistentStateException(
                                    "Contact " + contactId + " points at missing primary " + rootId);
                        });
                return Optional.of(responseBuilder.build(primary, members));
            });
        }
    }

    private IdentifyResult identifyWithRetry(IdentifyRequest request) {
        for (int attempt = 1; ; attempt++) {
            try (IdentifierLocks held = IdentifierLocks.acquire(
                    distributedLock, request.email(), request.phoneNumber())) {
                return store.inTransaction(tx -> reconcile(tx, request));
            } catch (StoreException | ClusterContentionException e) {
                if (!isRetryable(e) || attempt >= options.getMaxAttempts()) {
                    throw e;
                }
                log.warn("identify.retry attempt={} maxAttempts={} error={}",
                        attempt, options.getMaxAttempts(), e.getMessage());
                metricsService.incrementIdentifyRetried();
                pause();
            }
        }
    }

    private IdentifyResult reconcile(ContactTransaction tx, IdentifyRequest request) {
        List<Contact> matches = matcher.findMatches(tx, request.email(), request.phoneNumber());
        if (matches.isEmpty()) {
            Contact created = tx.createContact(NewContact.primary(request.email(), request.phoneNumber()));
            return new IdentifyResult(
                    responseBuilder.build(created, List.of(created)),
                    IdentifyOutcome.NEW_PRIMARY, Optional.of(created), List.of());
        }

        ResolvedCluster cluster = clusterResolver.resolve(tx, matches);
        Optional<Contact> created = secondaryPolicy.secondaryFor(cluster, request).map(tx::createContact);
        if (created.isPresent()) {
            cluster = cluster.withMember(created.get());
        }

        IdentifyOutcome outcome;
        if (cluster.isMerged()) {
            outcome = IdentifyOutcome.MERGED;
        } else if (created.isPresent()) {
            outcome = IdentifyOutcome.NEW_SECONDARY;
        } else {
            outcome = IdentifyOutcome.MATCHED;
        }
        return new IdentifyResult(
                responseBuilder.build(cluster.primary(), cluster.members()),
                outcome, created, cluster.merges());
    }

    private void recordCommitted(IdentifyResult result, Duration duration) {
        String actor = options.getSourceSystem();
        result.createdContact().ifPresent(created -> {
            auditService.record(AuditAction.CONTACT_CREATED, created.getId(), actor, Map.of(
                    "linkPrecedence", created.getLinkPrecedence().dbValue(),
                    "primaryContactId", result.contact().primaryContactId()));
            metricsService.incrementContactCreated(created.getLinkPrecedence());
        });
        for (ClusterMerge merge : result.merges()) {
            auditService.record(AuditAction.PRIMARY_DEMOTED, merge.stalePrimaryId(), actor,
                    Map.of("truePrimaryId", merge.truePrimaryId()));
            if (merge.relinkedCount() > 0) {
                auditService.record(AuditAction.CONTACTS_RELINKED, merge.truePrimaryId(), actor, Map.of(
                        "fromPrimaryId", merge.stalePrimaryId(),
                        "count", merge.relinkedCount()));
            }
        }
        if (!result.merges().isEmpty()) {
            metricsService.incrementPrimaryDemoted(result.merges().size());
        }
        metricsService.recordClusterSize(result.contact().clusterSize());
        metricsService.recordIdentifyDuration(result.outcome(), duration);
    }

    private static boolean isRetryable(RuntimeException e) {
        if (e instanceof StoreException storeException) {
            return storeException.isRetryable();
        }
        return e instanceof ClusterContentionException;
    }

    private void pause() {
        if (options.getRetryDelayMs() == 0) {
            return;
        }
        try {
            Thread.sleep(options.getRetryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting to retry identify", e);
        }
    }
}
