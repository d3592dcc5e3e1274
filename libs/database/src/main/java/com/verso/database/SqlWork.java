package com.verso.database;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work run by a {@link ConnectionSource}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SqlWork<T> {

    T run(Connection connection) throws SQLException;
}
