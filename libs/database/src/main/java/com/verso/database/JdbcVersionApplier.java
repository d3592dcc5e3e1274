package com.verso.database;

import com.verso.versioner.VersionApplier;
import com.verso.versioner.VersionStoreException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VersionApplier} keeping the version history in a relational table.
 *
 * <p>Every successful change appends one row ({@code id}, {@code version}, {@code
 * modification_time}); the current version is the most recent row. Modification times are stored
 * as UTC wall-clock values, independent of the JVM's default zone. The table itself is created by
 * {@link VersionTableVersion}, normally the first version of the set: until it exists the structure
 * reads as {@link #UNVERSIONED}.
 *
 * <pre>{@code
 * CREATE TABLE schema_version (
 *     id uuid PRIMARY KEY,
 *     version integer NOT NULL,
 *     modification_time timestamp(6) NOT NULL)
 * }</pre>
 */
public class JdbcVersionApplier implements VersionApplier {

    private static final Logger log = LoggerFactory.getLogger(JdbcVersionApplier.class);

    /** Table used when none is configured. */
    public static final String DEFAULT_TABLE = "schema_version";

    // undefined_table (PostgreSQL), base table not found (SQL standard), H2's table-not-found code
    private static final String[] MISSING_TABLE_STATES = {"42P01", "42S02", "42102"};

    private final ConnectionSource connections;
    private final String table;
    private final Clock clock;
    private Instant lastStamp;

    public JdbcVersionApplier(ConnectionSource connections) {
        this(connections, DEFAULT_TABLE, Clock.systemUTC());
    }

    public JdbcVersionApplier(ConnectionSource connections, String table) {
        this(connections, table, Clock.systemUTC());
    }

    /**
     * @param connections where to run the queries
     * @param table tracking table name, optionally schema-qualified
     * @param clock source of modification times
     */
    public JdbcVersionApplier(ConnectionSource connections, String table, Clock clock) {
        if (connections == null) {
            throw new IllegalArgumentException("connections must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.connections = connections;
        this.table = TableNames.require(table);
        this.clock = clock;
    }

    @Override
    public int currentVersion() {
        String sql =
                "SELECT version FROM " + table + " ORDER BY modification_time DESC LIMIT 1";
        try {
            return connections.withConnection(
                    connection -> {
                        try (Statement statement = connection.createStatement();
                                ResultSet rows = statement.executeQuery(sql)) {
                            return rows.next() ? rows.getInt(1) : UNVERSIONED;
                        }
                    });
        } catch (SQLException e) {
            if (isMissingTable(e)) {
                log.debug("Version table {} does not exist yet", table);
                return UNVERSIONED;
            }
            throw new VersionStoreException("could not get current version", e);
        }
    }

    @Override
    public void syncVersion(int versionNumber) {
        String sql =
                "INSERT INTO " + table + " (id, version, modification_time) VALUES (?, ?, ?)";
        LocalDateTime stamp = LocalDateTime.ofInstant(nextStamp(), ZoneOffset.UTC);
        try {
            connections.withConnection(
                    connection -> {
                        try (PreparedStatement insert = connection.prepareStatement(sql)) {
                            insert.setObject(1, UUID.randomUUID());
                            insert.setInt(2, versionNumber);
                            insert.setObject(3, stamp);
                            return insert.executeUpdate();
                        }
                    });
        } catch (SQLException e) {
            throw new VersionStoreException("could not insert version " + versionNumber, e);
        }
    }

    /** Rows written within one clock tick still have to order by insertion. */
    private Instant nextStamp() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (lastStamp != null && !now.isAfter(lastStamp)) {
            now = lastStamp.plus(1, ChronoUnit.MICROS);
        }
        lastStamp = now;
        return now;
    }

    static boolean isMissingTable(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sqlException) {
                String state = sqlException.getSQLState();
                for (String missing : MISSING_TABLE_STATES) {
                    if (missing.equals(state)) {
                        return true;
                    }
                }
            }
            String message = t.getMessage();
            if (message != null
                    && (message.contains("not exist") || message.contains("not found"))) {
                return true;
            }
        }
        return false;
    }

    public String table() {
        return table;
    }
}
