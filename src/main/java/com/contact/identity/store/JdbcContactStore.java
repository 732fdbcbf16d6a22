package com.contact.identity.store;

import com.contact.identity.core.model.Contact;
import com.contact.identity.core.model.LinkPrecedence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Relational implementation of {@link ContactStore} over a JDBC {@link DataSource}.
 * Each transaction runs on its own connection at READ COMMITTED, with auto-commit
 * off; row locks come from {@code SELECT ... FOR UPDATE}.
 *
 * <p>Written against PostgreSQL; the same SQL runs on H2 in PostgreSQL mode.</p>
 */
public class JdbcContactStore implements ContactStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcContactStore.class);

    private static final String COLUMNS =
            "id, email, phone_number, linked_id, link_precedence, created_at, updated_at, deleted_at";

    private static final Set<String> TIMEOUT_SQL_STATES = Set.of(
            "HYT00", // H2 lock timeout, generic JDBC timeout
            "57014", // PostgreSQL query_canceled (statement timeout)
            "55P03"  // PostgreSQL lock_not_available
    );

    private static final Set<String> CONFLICT_SQL_STATES = Set.of(
            "40001", // serialization_failure, H2 deadlock
            "40P01"  // PostgreSQL deadlock_detected
    );

    private final DataSource dataSource;
    private final StoreConfig config;
    private final Clock clock;

    public JdbcContactStore(DataSource dataSource) {
        this(dataSource, StoreConfig.defaults(), Clock.systemUTC());
    }

    public JdbcContactStore(DataSource dataSource, StoreConfig config) {
        this(dataSource, config, Clock.systemUTC());
    }

    public JdbcContactStore(DataSource dataSource, StoreConfig config, Clock clock) {
        this.dataSource = dataSource;
        this.config = config;
        this.clock = clock;
        if (config.isInitializeSchema()) {
            initializeSchema();
        }
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            try {
                T result = work.execute(new JdbcTransaction(connection));
                ensureActive();
                connection.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(connection, e);
                throw e;
            } catch (SQLException e) {
                StoreException translated = translate("commit", e);
                rollback(connection, translated);
                throw translated;
            }
        } catch (SQLException e) {
            throw translate("open transaction", e);
        }
    }

    @Override
    public void ping() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(config.getQueryTimeoutSeconds());
            statement.execute("SELECT 1");
        } catch (SQLException e) {
            throw translate("ping", e);
        }
    }

    @Override
    public String getName() {
        return "jdbc";
    }

    /**
     * Soft-deletes a contact. Tombstoning is managed outside the reconciliation
     * core; this hook exists for administration and test fixtures.
     */
    public void tombstone(long id) {
        inTransaction(tx -> {
            JdbcTransaction jdbc = (JdbcTransaction) tx;
            jdbc.executeUpdate("UPDATE contact SET deleted_at = ?, updated_at = ? WHERE id = ?",
                    List.of(now(), now(), id));
            return null;
        });
    }

    private void initializeSchema() {
        String script;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(config.getSchemaResource())) {
            if (in == null) {
                throw new StoreUnavailableException("Schema resource not found: " + config.getSchemaResource());
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot read schema resource " + config.getSchemaResource(), e);
        }

        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : script.split(";")) {
                String trimmed = stripComments(sql);
                if (!trimmed.isEmpty()) {
                    statement.execute(trimmed);
                }
            }
            log.info("Contact schema initialized from {}", config.getSchemaResource());
        } catch (SQLException e) {
            throw translate("initialize schema", e);
        }
    }

    private static String stripComments(String sql) {
        StringBuilder out = new StringBuilder();
        for (String line : sql.split("\n")) {
            if (!line.trim().startsWith("--")) {
                out.append(line).append('\n');
            }
        }
        return out.toString().trim();
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
            log.debug("Transaction rolled back: {}", cause.getMessage());
        } catch (SQLException e) {
            log.error("Rollback failed after '{}': {}", cause.getMessage(), e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    // timestamptz keeps microseconds
    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant().truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }

    static StoreException translate(String operation, SQLException e) {
        if (e instanceof SQLTimeoutException || TIMEOUT_SQL_STATES.contains(e.getSQLState())) {
            return new StoreTimeoutException("Store " + operation + " timed out: " + e.getMessage(), e);
        }
        if (CONFLICT_SQL_STATES.contains(e.getSQLState())) {
            return new StoreConflictException("Store " + operation + " aborted by a concurrent transaction: "
                    + e.getMessage(), e);
        }
        return new StoreUnavailableException("Store " + operation + " failed: " + e.getMessage(), e);
    }

    private static void ensureActive() {
        if (Thread.currentThread().isInterrupted()) {
            throw new StoreUnavailableException("Transaction cancelled: calling thread was interrupted");
        }
    }

    private class JdbcTransaction implements ContactTransaction {

        private final Connection connection;

        JdbcTransaction(Connection connection) {
            this.connection = connection;
        }

        @Override
        public List<Contact> findContacts(ContactCriteria criteria) {
            if (criteria.isEmpty()) {
                return List.of();
            }
            List<Object> params = new ArrayList<>();
            String where = whereClause(criteria, params);
            String sql = "SELECT " + COLUMNS + " FROM contact WHERE deleted_at IS NULL AND (" + where + ")"
                    + " ORDER BY created_at ASC, id ASC";
            return executeQuery(sql, params);
        }

        @Override
        public List<Contact> lockContacts(Collection<Long> ids) {
            if (ids.isEmpty()) {
                return List.of();
            }
            List<Object> params = new ArrayList<>(new TreeSet<>(ids));
            String sql = "SELECT " + COLUMNS + " FROM contact WHERE deleted_at IS NULL AND id IN ("
                    + placeholders(params.size()) + ") ORDER BY id FOR UPDATE";
            return executeQuery(sql, params);
        }

        @Override
        public Contact createContact(NewContact contact) {
            ensureActive();
            OffsetDateTime now = now();
            String sql = """
                    INSERT INTO contact (email, phone_number, linked_id, link_precedence, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """;
            try (PreparedStatement statement = connection.prepareStatement(sql, new String[]{"id"})) {
                statement.setQueryTimeout(config.getQueryTimeoutSeconds());
                bind(statement, 1, contact.email().orElse(null));
                bind(statement, 2, contact.phoneNumber().orElse(null));
                if (contact.linkedId().isPresent()) {
                    statement.setLong(3, contact.linkedId().get());
                } else {
                    statement.setNull(3, Types.BIGINT);
                }
                bind(statement, 4, contact.linkPrecedence().dbValue());
                bind(statement, 5, now);
                bind(statement, 6, now);
                statement.executeUpdate();
                try (ResultSet keys = statement.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new StoreUnavailableException("Insert returned no generated id");
                    }
                    return Contact.builder()
                            .id(keys.getLong(1))
                            .email(contact.email().orElse(null))
                            .phoneNumber(contact.phoneNumber().orElse(null))
                            .linkedId(contact.linkedId().orElse(null))
                            .linkPrecedence(contact.linkPrecedence())
                            .createdAt(now.toInstant())
                            .updatedAt(now.toInstant())
                            .build();
                }
            } catch (SQLException e) {
                throw translate("create contact", e);
            }
        }

        @Override
        public void updateContact(long id, ContactUpdate update) {
            int updated = updateContactsWhere(ContactCriteria.anyOf().ids(List.of(id)).build(), update);
            if (updated == 0) {
                throw new StoreException("Contact not found: " + id);
            }
        }

        @Override
        public int updateContactsWhere(ContactCriteria criteria, ContactUpdate update) {
            if (criteria.isEmpty()) {
                return 0;
            }
            List<Object> params = new ArrayList<>();
            StringBuilder sql = new StringBuilder("UPDATE contact SET linked_id = ?, updated_at = ?");
            params.add(update.linkedId());
            params.add(now());
            update.linkPrecedence().ifPresent(precedence -> {
                sql.append(", link_precedence = ?");
                params.add(precedence.dbValue());
            });
            sql.append(" WHERE deleted_at IS NULL AND (").append(whereClause(criteria, params)).append(')');
            return executeUpdate(sql.toString(), params);
        }

        int executeUpdate(String sql, List<Object> params) {
            ensureActive();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setQueryTimeout(config.getQueryTimeoutSeconds());
                bindAll(statement, params);
                return statement.executeUpdate();
            } catch (SQLException e) {
                throw translate("update", e);
            }
        }

        private List<Contact> executeQuery(String sql, List<Object> params) {
            ensureActive();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setQueryTimeout(config.getQueryTimeoutSeconds());
                bindAll(statement, params);
                try (ResultSet rs = statement.executeQuery()) {
                    List<Contact> contacts = new ArrayList<>();
                    while (rs.next()) {
                        contacts.add(mapRow(rs));
                    }
                    return contacts;
                }
            } catch (SQLException e) {
                throw translate("query", e);
            }
        }
    }

    private static String whereClause(ContactCriteria criteria, List<Object> params) {
        List<String> predicates = new ArrayList<>();
        criteria.email().ifPresent(email -> {
            predicates.add("email = ?");
            params.add(email);
        });
        criteria.phoneNumber().ifPresent(phone -> {
            predicates.add("phone_number = ?");
            params.add(phone);
        });
        if (!criteria.ids().isEmpty()) {
            predicates.add("id IN (" + placeholders(criteria.ids().size()) + ")");
            params.addAll(criteria.ids());
        }
        if (!criteria.linkedIds().isEmpty()) {
            predicates.add("linked_id IN (" + placeholders(criteria.linkedIds().size()) + ")");
            params.addAll(criteria.linkedIds());
        }
        return String.join(" OR ", predicates);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static void bindAll(PreparedStatement statement, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            bind(statement, i + 1, params.get(i));
        }
    }

    private static void bind(PreparedStatement statement, int index, Object value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.VARCHAR);
        } else if (value instanceof Long longValue) {
            statement.setLong(index, longValue);
        } else if (value instanceof String stringValue) {
            statement.setString(index, stringValue);
        } else {
            statement.setObject(index, value);
        }
    }

    private static Contact mapRow(ResultSet rs) throws SQLException {
        long linkedId = rs.getLong("linked_id");
        Long linked = rs.wasNull() ? null : linkedId;
        return Contact.builder()
                .id(rs.getLong("id"))
                .email(rs.getString("email"))
                .phoneNumber(rs.getString("phone_number"))
                .linkedId(linked)
                .linkPrecedence(LinkPrecedence.fromDbValue(rs.getString("link_precedence")))
                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                .updatedAt(toInstant(rs.getObject("updated_at", OffsetDateTime.class)))
                .deletedAt(toInstant(rs.getObject("deleted_at", OffsetDateTime.class)))
                .build();
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
