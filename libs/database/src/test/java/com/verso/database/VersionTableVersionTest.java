package com.verso.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.verso.versioner.ChangeException;
import com.verso.versioner.RollbackUnsupportedException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VersionTableVersion")
class VersionTableVersionTest {

    private DataSource dataSource;
    private Statement statement;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
    }

    @Test
    @DisplayName("is version 0 on the default table by default")
    void defaults() {
        var version = new VersionTableVersion(ConnectionSource.of(dataSource));

        assertThat(version.number()).isZero();
        assertThat(version).hasToString("VersionTableVersion[0, schema_version]");
    }

    @Test
    @DisplayName("upgrade creates the tracking table if missing")
    void upgradeCreatesTable() throws SQLException {
        new VersionTableVersion(ConnectionSource.of(dataSource), 0, "ops.schema_version").upgrade();

        verify(statement)
                .executeUpdate(
                        "CREATE TABLE IF NOT EXISTS ops.schema_version (id UUID PRIMARY KEY,"
                                + " version INTEGER NOT NULL,"
                                + " modification_time TIMESTAMP(6) NOT NULL)");
        verify(statement).close();
    }

    @Test
    @DisplayName("DDL failure surfaces as ChangeException for its number")
    void ddlFailureThrows() throws SQLException {
        var failure = new SQLException("permission denied for schema ops", "42501");
        when(statement.executeUpdate(anyString())).thenThrow(failure);
        var version = new VersionTableVersion(ConnectionSource.of(dataSource), 5, "ops.versions");

        assertThatThrownBy(version::upgrade)
                .isInstanceOf(ChangeException.class)
                .hasMessage("creating table 'ops.versions' failed")
                .hasCause(failure)
                .satisfies(e -> assertThat(((ChangeException) e).versionNumber()).isEqualTo(5));
    }

    @Test
    @DisplayName("rollback is unsupported and touches nothing")
    void rollbackUnsupported() {
        var version = new VersionTableVersion(ConnectionSource.of(dataSource));

        assertThatThrownBy(version::rollback)
                .isInstanceOf(RollbackUnsupportedException.class)
                .hasMessage("cannot rollback version 0");
        verifyNoInteractions(dataSource);
    }
}
