package com.verso.database;

import com.verso.versioner.ChangeException;
import com.verso.versioner.RollbackUnsupportedException;
import com.verso.versioner.Version;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Bootstrap version creating the table {@link JdbcVersionApplier} records versions in.
 *
 * <p>Should be the first version of the set, numbered {@value #DEFAULT_NUMBER}: it is applied to a
 * pristine ({@code -1}) structure before anything else. It cannot be rolled back, since dropping the
 * table would erase the history recording that it was created.
 */
public class VersionTableVersion implements Version {

    /** Number strongly suggested for the bootstrap version. */
    public static final int DEFAULT_NUMBER = 0;

    private final ConnectionSource connections;
    private final int number;
    private final String table;

    public VersionTableVersion(ConnectionSource connections) {
        this(connections, DEFAULT_NUMBER, JdbcVersionApplier.DEFAULT_TABLE);
    }

    /**
     * @param connections where to run the DDL
     * @param number version number of the bootstrap change
     * @param table tracking table name; must match the applier's
     */
    public VersionTableVersion(ConnectionSource connections, int number, String table) {
        if (connections == null) {
            throw new IllegalArgumentException("connections must not be null");
        }
        this.connections = connections;
        this.number = number;
        this.table = TableNames.require(table);
    }

    @Override
    public int number() {
        return number;
    }

    @Override
    public void upgrade() {
        String ddl =
                "CREATE TABLE IF NOT EXISTS "
                        + table
                        + " (id UUID PRIMARY KEY,"
                        + " version INTEGER NOT NULL,"
                        + " modification_time TIMESTAMP(6) NOT NULL)";
        try {
            connections.withConnection(
                    connection -> {
                        try (Statement statement = connection.createStatement()) {
                            return statement.executeUpdate(ddl);
                        }
                    });
        } catch (SQLException e) {
            throw new ChangeException(number, "creating table '" + table + "' failed", e);
        }
    }

    @Override
    public void rollback() {
        throw new RollbackUnsupportedException(number);
    }

    @Override
    public String toString() {
        return "VersionTableVersion[" + number + ", " + table + "]";
    }
}
