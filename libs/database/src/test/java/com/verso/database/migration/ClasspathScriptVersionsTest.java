package com.verso.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.verso.database.ConnectionSource;
import com.verso.database.SqlScriptVersion;
import com.verso.versioner.Version;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.ResourcePatternResolver;

/**
 * Unit tests for {@link ClasspathScriptVersions} against the script sets under {@code
 * src/test/resources/db}.
 */
@DisplayName("ClasspathScriptVersions")
class ClasspathScriptVersionsTest {

    private final ConnectionSource connections = ConnectionSource.of(mock(DataSource.class));

    @Test
    @DisplayName("loads upgrade scripts in order and pairs undo scripts")
    void loadsVersions() {
        List<Version> versions =
                ClasspathScriptVersions.load("classpath:db/versions", connections);

        assertThat(versions).extracting(Version::number).containsExactly(1, 2);
        assertThat(versions).allMatch(SqlScriptVersion.class::isInstance);

        var first = (SqlScriptVersion) versions.get(0);
        var second = (SqlScriptVersion) versions.get(1);
        assertThat(first.description()).isEqualTo("create accounts");
        assertThat(first.isReversible()).isTrue();
        assertThat(second.description()).isEqualTo("add account email");
        assertThat(second.isReversible()).isFalse();
    }

    @Test
    @DisplayName("a trailing slash in the location is accepted")
    void trailingSlash() {
        assertThat(ClasspathScriptVersions.load("classpath:db/versions/", connections)).hasSize(2);
    }

    @Test
    @DisplayName("two upgrade scripts for one number fail the load")
    void duplicateNumbers() {
        assertThatThrownBy(
                        () -> ClasspathScriptVersions.load("classpath:db/duplicates", connections))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("duplicate upgrade scripts for version 1");
    }

    @Test
    @DisplayName("an undo script without its upgrade fails the load")
    void orphanUndo() {
        assertThatThrownBy(
                        () -> ClasspathScriptVersions.load("classpath:db/orphan-undo", connections))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("undo script U3__x.sql has no upgrade script");
    }

    @Test
    @DisplayName("a version number too large for an int fails the load naming the file")
    void numberOutOfRange() {
        assertThatThrownBy(() -> ClasspathScriptVersions.load("classpath:db/overflow", connections))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("version number of V99999999999__too_big.sql is out of range")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("a location that cannot be scanned surfaces as UncheckedIOException")
    void scanFailure() throws IOException {
        ResourcePatternResolver resolver = mock(ResourcePatternResolver.class);
        when(resolver.getResources(anyString())).thenThrow(new IOException("jar is corrupt"));

        assertThatThrownBy(
                        () ->
                                ClasspathScriptVersions.load(
                                        resolver, "classpath:broken", connections))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessage("could not scan classpath:broken");
    }

    @Test
    @DisplayName("rejects a blank location")
    void rejectsBlankLocation() {
        assertThatThrownBy(() -> ClasspathScriptVersions.load(" ", connections))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
