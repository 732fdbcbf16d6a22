package com.contact.identity.store;

import com.contact.identity.core.model.Contact;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Filter for contact reads and bulk updates: a disjunction of the predicates set
 * on it. Tombstoned contacts never match, whatever the predicates.
 *
 * <pre>
 * ContactCriteria.anyOf()
 *     .email(Optional.of("a@x.com"))
 *     .phoneNumber(Optional.empty())   // predicate omitted
 *     .build();
 * </pre>
 */
public final class ContactCriteria {

    private final String email;
    private final String phoneNumber;
    private final Set<Long> ids;
    private final Set<Long> linkedIds;

    private ContactCriteria(Builder builder) {
        this.email = builder.email;
        this.phoneNumber = builder.phoneNumber;
        this.ids = Set.copyOf(builder.ids);
        this.linkedIds = Set.copyOf(builder.linkedIds);
    }

    /**
     * All contacts of the clusters rooted at the given ids: the roots themselves
     * plus everything linked to them.
     */
    public static ContactCriteria clusterMembers(Collection<Long> rootIds) {
        return anyOf().ids(rootIds).linkedIds(rootIds).build();
    }

    public static ContactCriteria linkedTo(long primaryId) {
        return anyOf().linkedIds(Set.of(primaryId)).build();
    }

    public Optional<String> email() {
        return Optional.ofNullable(email);
    }

    public Optional<String> phoneNumber() {
        return Optional.ofNullable(phoneNumber);
    }

    public Set<Long> ids() {
        return ids;
    }

    public Set<Long> linkedIds() {
        return linkedIds;
    }

    /**
     * True when no predicate is set; such criteria match nothing.
     */
    public boolean isEmpty() {
        return email == null && phoneNumber == null && ids.isEmpty() && linkedIds.isEmpty();
    }

    /**
     * Evaluates the criteria against a contact, including the tombstone filter.
     */
    public boolean matches(Contact contact) {
        if (contact.isDeleted()) {
            return false;
        }
        if (email != null && contact.getEmail().filter(email::equals).isPresent()) {
            return true;
        }
        if (phoneNumber != null && contact.getPhoneNumber().filter(phoneNumber::equals).isPresent()) {
            return true;
        }
        if (ids.contains(contact.getId())) {
            return true;
        }
        return contact.getLinkedId().filter(linkedIds::contains).isPresent();
    }

    @Override
    public String toString() {
        return "ContactCriteria{" +
                "email=" + (email != null) +
                ", phoneNumber=" + (phoneNumber != null) +
                ", ids=" + ids +
                ", linkedIds=" + linkedIds +
                '}';
    }

    public static Builder anyOf() {
        return new Builder();
    }

    public static class Builder {
        private String email;
        private String phoneNumber;
        private final Set<Long> ids = new LinkedHashSet<>();
        private final Set<Long> linkedIds = new LinkedHashSet<>();

        public Builder email(Optional<String> email) {
            this.email = email.orElse(null);
            return this;
        }

        public Builder phoneNumber(Optional<String> phoneNumber) {
            this.phoneNumber = phoneNumber.orElse(null);
            return this;
        }

        public Builder ids(Collection<Long> ids) {
            this.ids.addAll(ids);
            return this;
        }

        public Builder linkedIds(Collection<Long> linkedIds) {
            this.linkedIds.addAll(linkedIds);
            return this;
        }

        public ContactCriteria build() {
            return new ContactCriteria(this);
        }
    }
}
