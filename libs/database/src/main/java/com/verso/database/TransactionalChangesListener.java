package com.verso.database;

import com.verso.versioner.SyncEvent;
import com.verso.versioner.SyncListener;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps every change of a sync in its own database transaction.
 *
 * <p>On before-change a connection is taken from the data source with auto-commit off and kept
 * until after-change (commit) or error-during-change (rollback), after which it is closed. Failing
 * to begin, commit or roll back throws a {@link TransactionException}, which vetoes the sync.
 *
 * <p>The listener is also a {@link ConnectionSource}: the applier and SQL versions built on it run
 * inside the open transaction, so a script and the row recording its version commit or roll back
 * together. Outside a change it hands out plain connections from the data source.
 *
 * <pre>{@code
 * var transactions = new TransactionalChangesListener(dataSource);
 * var applier = new JdbcVersionApplier(transactions);
 * var versions = ClasspathScriptVersions.load("classpath:db/versions", transactions);
 * try (transactions) {
 *     new Versioner(applier, versions, transactions).upgradeToLast();
 * }
 * }</pre>
 *
 * <p>At most one transaction is open at a time; the versioner never nests changes.
 */
public final class TransactionalChangesListener
        implements SyncListener, ConnectionSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionalChangesListener.class);

    private final DataSource dataSource;
    private Connection currentTransaction;

    public TransactionalChangesListener(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
    }

    @Override
    public void on(SyncEvent event) {
        switch (event.type()) {
            case BEFORE_CHANGE -> begin();
            case AFTER_CHANGE -> end("commit", Connection::commit);
            case ERROR_DURING_CHANGE -> end("rollback", Connection::rollback);
            default -> {
                // transactions only span single changes
            }
        }
    }

    @Override
    public <T> T withConnection(SqlWork<T> work) throws SQLException {
        if (currentTransaction != null) {
            return work.run(currentTransaction);
        }
        try (Connection connection = dataSource.getConnection()) {
            return work.run(connection);
        }
    }

    /** Whether a change's transaction is currently open. */
    public boolean inTransaction() {
        return currentTransaction != null;
    }

    /**
     * Rolls back and releases a transaction left open because a sync was aborted between
     * before-change and after-change. The listener stays usable afterwards.
     *
     * @throws TransactionException if the rollback fails
     */
    @Override
    public void close() {
        if (currentTransaction != null) {
            log.warn("Rolling back transaction left open by an aborted change");
            end("rollback", Connection::rollback);
        }
    }

    private void begin() {
        if (currentTransaction != null) {
            throw new IllegalStateException("a transaction is already open for another change");
        }
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new TransactionException("could not begin transaction", e);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new TransactionException("could not begin transaction", e);
        }
        currentTransaction = connection;
    }

    private void end(String operation, SqlAction action) {
        Connection connection = currentTransaction;
        if (connection == null) {
            throw new IllegalStateException("no open transaction to " + operation);
        }
        currentTransaction = null;
        try (connection) {
            action.run(connection);
        } catch (SQLException e) {
            throw new TransactionException("could not " + operation + " transaction", e);
        }
    }

    @FunctionalInterface
    private interface SqlAction {
        void run(Connection connection) throws SQLException;
    }
}
