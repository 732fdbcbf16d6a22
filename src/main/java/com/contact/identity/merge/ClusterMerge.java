package com.contact.identity.merge;

/**
 * One stale primary folded into the true primary.
 *
 * @param stalePrimaryId the primary that was demoted to secondary
 * @param truePrimaryId  the surviving primary
 * @param relinkedCount  secondaries moved from the stale primary to the true primary
 */
public record ClusterMerge(long stalePrimaryId, long truePrimaryId, int relinkedCount) {
}
