package com.verso.database;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/** Connection per unit of work, closed afterwards. */
final class DataSourceConnectionSource implements ConnectionSource {

    private final DataSource dataSource;

    DataSourceConnectionSource(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public <T> T withConnection(SqlWork<T> work) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            return work.run(connection);
        }
    }
}
