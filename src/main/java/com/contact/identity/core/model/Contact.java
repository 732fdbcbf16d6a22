package com.contact.identity.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A single contact record: one email and/or phone number observed for a customer.
 * Contacts referring to the same customer form a cluster rooted at a primary.
 *
 * <p>Instances are immutable snapshots of a stored row. Mutations (demotion,
 * re-linking) go through the store and are observed by re-reading.</p>
 */
public final class Contact {

    /**
     * Seniority order: earliest {@code createdAt} first, smallest id on ties.
     */
    public static final Comparator<Contact> SENIORITY =
            Comparator.comparing(Contact::getCreatedAt).thenComparingLong(Contact::getId);

    private final long id;
    private final String email;
    private final String phoneNumber;
    private final Long linkedId;
    private final LinkPrecedence linkPrecedence;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant deletedAt;

    private Contact(Builder builder) {
        this.id = builder.id;
        this.email = builder.email;
        this.phoneNumber = builder.phoneNumber;
        this.linkedId = builder.linkedId;
        this.linkPrecedence = builder.linkPrecedence;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.deletedAt = builder.deletedAt;
    }

    public long getId() {
        return id;
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email);
    }

    public Optional<String> getPhoneNumber() {
        return Optional.ofNullable(phoneNumber);
    }

    public Optional<Long> getLinkedId() {
        return Optional.ofNullable(linkedId);
    }

    public LinkPrecedence getLinkPrecedence() {
        return linkPrecedence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Optional<Instant> getDeletedAt() {
        return Optional.ofNullable(deletedAt);
    }

    public boolean isPrimary() {
        return linkPrecedence == LinkPrecedence.PRIMARY;
    }

    public boolean isSecondary() {
        return linkPrecedence == LinkPrecedence.SECONDARY;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Id of the primary this contact belongs to: its own id for a primary,
     * its linked id for a secondary.
     *
     * @throws IllegalStateException if a secondary carries no linked id
     */
    public long clusterRootId() {
        if (isPrimary()) {
            return id;
        }
        if (linkedId == null) {
            throw new IllegalStateException("Secondary contact " + id + " has no linkedId");
        }
        return linkedId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Contact contact = (Contact) o;
        return id == contact.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Contact{" +
                "id=" + id +
                ", email='" + email + '\'' +
                ", phoneNumber='" + phoneNumber + '\'' +
                ", linkedId=" + linkedId +
                ", linkPrecedence=" + linkPrecedence +
                ", createdAt=" + createdAt +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Contact contact) {
        return new Builder()
                .id(contact.id)
                .email(contact.email)
                .phoneNumber(contact.phoneNumber)
                .linkedId(contact.linkedId)
                .linkPrecedence(contact.linkPrecedence)
                .createdAt(contact.createdAt)
                .updatedAt(contact.updatedAt)
                .deletedAt(contact.deletedAt);
    }

    public static class Builder {
        private long id;
        private String email;
        private String phoneNumber;
        private Long linkedId;
        private LinkPrecedence linkPrecedence;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant deletedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phoneNumber(String phoneNumber) {
            this.phoneNumber = phoneNumber;
            return this;
        }

        public Builder linkedId(Long linkedId) {
            this.linkedId = linkedId;
            return this;
        }

        public Builder linkPrecedence(LinkPrecedence linkPrecedence) {
            this.linkPrecedence = linkPrecedence;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Contact build() {
            Objects.requireNonNull(linkPrecedence, "linkPrecedence is required");
            Objects.requireNonNull(createdAt, "createdAt is required");
            if (linkPrecedence == LinkPrecedence.PRIMARY && linkedId != null) {
                throw new IllegalArgumentException("A primary contact cannot carry a linkedId");
            }
            return new Contact(this);
        }
    }
}
