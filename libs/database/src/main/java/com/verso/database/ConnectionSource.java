package com.verso.database;

import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Where JDBC collaborators of the versioner get their connection from.
 *
 * <p>The applier and the SQL versions never open connections themselves: they hand their work to a
 * source. {@link #of(DataSource)} opens a fresh connection per unit of work; {@link
 * TransactionalChangesListener} runs work on the transaction of the change in flight, so a script
 * and the marker recording it commit together.
 */
public interface ConnectionSource {

    /**
     * Runs {@code work} on a connection owned by this source.
     *
     * @param work the work to run; must not close the connection
     * @return the work's result
     * @throws SQLException if the connection cannot be obtained or the work fails
     */
    <T> T withConnection(SqlWork<T> work) throws SQLException;

    /** Source that borrows a connection from {@code dataSource} for each unit of work. */
    static ConnectionSource of(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        return new DataSourceConnectionSource(dataSource);
    }
}
