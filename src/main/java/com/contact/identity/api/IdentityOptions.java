package com.contact.identity.api;

/**
 * Options for {@link ContactIdentityService}.
 */
public class IdentityOptions {

    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 50;

    private final int maxAttempts;
    private final long retryDelayMs;
    private final String sourceSystem;

    private IdentityOptions(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.retryDelayMs = builder.retryDelayMs;
        this.sourceSystem = builder.sourceSystem;
    }

    /**
     * Attempts per identify call, the first one included.
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    /**
     * Actor recorded in the audit trail.
     */
    public String getSourceSystem() {
        return sourceSystem;
    }

    public static IdentityOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private String sourceSystem = "IDENTIFY_API";

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("retryDelayMs must be >= 0");
            }
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("sourceSystem is required");
            }
            this.sourceSystem = sourceSystem;
            return this;
        }

        public IdentityOptions build() {
            return new IdentityOptions(this);
        }
    }

    @Override
    public String toString() {
        return "IdentityOptions{" +
                "maxAttempts=" + maxAttempts +
                ", retryDelayMs=" + retryDelayMs +
                ", sourceSystem='" + sourceSystem + '\'' +
                '}';
    }
}
