package com.contact.identity.audit;

/**
 * Store mutations recorded in the audit trail.
 */
public enum AuditAction {
    CONTACT_CREATED,
    PRIMARY_DEMOTED,
    CONTACTS_RELINKED
}
