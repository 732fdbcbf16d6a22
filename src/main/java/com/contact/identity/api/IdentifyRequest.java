package com.contact.identity.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifiers submitted to {@code identify}. Empty strings are absent values,
 * never identifiers to match on.
 */
public record IdentifyRequest(Optional<String> email, Optional<String> phoneNumber) {

    public IdentifyRequest {
        Objects.requireNonNull(email, "email is required");
        Objects.requireNonNull(phoneNumber, "phoneNumber is required");
        email = email.filter(v -> !v.isEmpty());
        phoneNumber = phoneNumber.filter(v -> !v.isEmpty());
    }

    /**
     * @param email       email or {@code null}
     * @param phoneNumber phone number or {@code null}
     */
    public static IdentifyRequest of(String email, String phoneNumber) {
        return new IdentifyRequest(Optional.ofNullable(email), Optional.ofNullable(phoneNumber));
    }

    public static IdentifyRequest ofEmail(String email) {
        return of(email, null);
    }

    public static IdentifyRequest ofPhoneNumber(String phoneNumber) {
        return of(null, phoneNumber);
    }

    public boolean hasBoth() {
        return email.isPresent() && phoneNumber.isPresent();
    }

    /**
     * @throws InvalidRequestException if neither identifier is present
     */
    public IdentifyRequest validate() {
        if (email.isEmpty() && phoneNumber.isEmpty()) {
            throw new InvalidRequestException("Either email or phoneNumber must be provided");
        }
        return this;
    }
}
