package com.contact.identity.store;

/**
 * Configuration for {@link JdbcContactStore}.
 */
public class StoreConfig {

    private final int queryTimeoutSeconds;
    private final boolean initializeSchema;
    private final String schemaResource;

    private StoreConfig(Builder builder) {
        this.queryTimeoutSeconds = builder.queryTimeoutSeconds;
        this.initializeSchema = builder.initializeSchema;
        this.schemaResource = builder.schemaResource;
    }

    public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public boolean isInitializeSchema() { return initializeSchema; }
    public String getSchemaResource() { return schemaResource; }

    public static StoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int queryTimeoutSeconds = 10;
        private boolean initializeSchema = true;
        private String schemaResource = "db/contact-schema.sql";

        public Builder queryTimeoutSeconds(int queryTimeoutSeconds) {
            if (queryTimeoutSeconds <= 0) throw new IllegalArgumentException("queryTimeoutSeconds must be > 0");
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        public Builder initializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
            return this;
        }

        public Builder schemaResource(String schemaResource) {
            if (schemaResource == null || schemaResource.isBlank()) {
                throw new IllegalArgumentException("schemaResource is required");
            }
            this.schemaResource = schemaResource;
            return this;
        }

        public StoreConfig build() {
            return new StoreConfig(this);
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "queryTimeoutSeconds=" + queryTimeoutSeconds +
                ", initializeSchema=" + initializeSchema +
                ", schemaResource='" + schemaResource + '\'' +
                '}';
    }
}
