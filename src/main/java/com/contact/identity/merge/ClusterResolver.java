package com.contact.identity.merge;

import com.contact.identity.core.model.Contact;
import com.contact.identity.logging.LogContext;
import com.contact.identity.store.ContactCriteria;
import com.contact.identity.store.ContactTransaction;
import com.contact.identity.store.ContactUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the contacts matched by a request into one cluster.
 *
 * <p>Resolution steps, all inside the caller's transaction:</p>
 * <ol>
 *   <li>Collect the cluster roots of the matches and row-lock them. A root that
 *       was demoted by a concurrent merge is followed to its new primary.</li>
 *   <li>Load every member of those clusters and pick the oldest primary
 *       (createdAt, then smallest id) as the true primary.</li>
 *   <li>Demote every other primary to a secondary of the true primary and
 *       re-link its secondaries.</li>
 *   <li>Re-read the true primary's membership.</li>
 * </ol>
 */
public class ClusterResolver {
    private static final Logger log = LoggerFactory.getLogger(ClusterResolver.class);

    static final int DEFAULT_MAX_ROOT_HOPS = 16;

    private final int maxRootHops;

    public ClusterResolver() {
        this(DEFAULT_MAX_ROOT_HOPS);
    }

    public ClusterResolver(int maxRootHops) {
        if (maxRootHops < 1) {
            throw new IllegalArgumentException("maxRootHops must be >= 1");
        }
        this.maxRootHops = maxRootHops;
    }

    /**
     * @param matches non-empty result of the matcher
     * @throws InconsistentStateException  if none of the touched clusters has a primary
     * @throws ClusterContentionException if the roots could not be pinned down
     */
    public ResolvedCluster resolve(ContactTransaction tx, List<Contact> matches) {
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("Cannot resolve a cluster without matches");
        }

        Set<Long> rootIds = new LinkedHashSet<>();
        for (Contact match : matches) {
            rootIds.add(match.clusterRootId());
        }
        Set<Long> lockedIds = lockRoots(tx, rootIds);

        List<Contact> candidates = tx.findContacts(ContactCriteria.clusterMembers(lockedIds));
        List<Contact> primaries = candidates.stream()
                .filter(Contact::isPrimary)
                .sorted(Contact.SENIORITY)
                .toList();
        if (primaries.isEmpty()) {
            log.error("cluster.inconsistent roots={} candidates={} reason=no-primary", lockedIds, candidates.size());
            throw new InconsistentStateException(
                    "No primary contact among " + candidates.size() + " candidates for roots " + lockedIds);
        }

        Contact truePrimary = primaries.get(0);
        if (primaries.size() > 1) {
            // re-link rows in id order rather than in whatever order the bulk update visits them
            tx.lockContacts(candidates.stream().map(Contact::getId).toList());
        }
        List<ClusterMerge> merges = new ArrayList<>();
        for (Contact stale : primaries.subList(1, primaries.size())) {
            merges.add(fold(tx, stale, truePrimary));
        }

        List<Contact> members = tx.findContacts(ContactCriteria.clusterMembers(List.of(truePrimary.getId())));
        Contact primary = members.stream()
                .filter(c -> c.getId() == truePrimary.getId())
                .findFirst()
                .orElse(truePrimary);
        return new ResolvedCluster(primary, members, merges);
    }

    /**
     * Locks the given roots, following demoted roots to their current primary
     * until every root reached is a primary.
     *
     * @return ids of every row requested along the way
     */
    private Set<Long> lockRoots(ContactTransaction tx, Collection<Long> initialRoots) {
        Set<Long> requested = new TreeSet<>(initialRoots);
        Set<Long> pending = new TreeSet<>(initialRoots);

        for (int hop = 0; hop < maxRootHops; hop++) {
            Set<Long> next = new TreeSet<>();
            for (Contact row : tx.lockContacts(pending)) {
                if (row.isSecondary()) {
                    long newRoot = row.clusterRootId();
                    if (requested.add(newRoot)) {
                        next.add(newRoot);
                    }
                }
            }
            if (next.isEmpty()) {
                if (hop > 0) {
                    log.debug("cluster.roots.followed hops={} roots={}", hop, requested);
                }
                return requested;
            }
            pending = next;
        }
        throw new ClusterContentionException(
                "Cluster roots still moving after " + maxRootHops + " lock attempts: " + requested);
    }

    private ClusterMerge fold(ContactTransaction tx, Contact stale, Contact truePrimary) {
        try (LogContext ignored = LogContext.forMerge(stale.getId(), truePrimary.getId())) {
            tx.updateContact(stale.getId(), ContactUpdate.demoteTo(truePrimary.getId()));
            int relinked = tx.updateContactsWhere(
                    ContactCriteria.linkedTo(stale.getId()), ContactUpdate.relinkTo(truePrimary.getId()));
            log.info("merge.completed stalePrimaryId={} truePrimaryId={} relinked={}",
                    stale.getId(), truePrimary.getId(), relinked);
            return new ClusterMerge(stale.getId(), truePrimary.getId(), relinked);
        }
    }
}
