package com.verso.database.migration;

import com.verso.database.JdbcVersionApplier;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.event.Level;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the schema versioner.
 *
 * <p>Spring Boot binds this record from {@code application.yml}; Bean Validation rejects a missing
 * URL or username at startup rather than at the first sync.
 *
 * <pre>{@code
 * verso:
 *   versioner:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/orders
 *     username: orders
 *     password: orders_dev_password
 *     locations: classpath:db/versions
 *     table: schema_version
 *     target-version: 12      # omit to upgrade to the last version
 *     transactional: true
 *     log-level: INFO
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username database username
 * @param password database password
 * @param locations where the {@code V{n}__*.sql}/{@code U{n}__*.sql} scripts live
 * @param table name of the version tracking table
 * @param targetVersion version to sync to at startup; null means the last available version
 * @param transactional whether each change runs in its own transaction
 * @param logLevel level of the progress log lines
 * @param enabled whether the versioner runs at all
 */
@Validated
@ConfigurationProperties(prefix = "verso.versioner")
public record VersionerProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        String table,
        Integer targetVersion,
        boolean transactional,
        Level logLevel,
        boolean enabled) {

    /** Script location used when none is configured. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/versions";

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public VersionerProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (table == null || table.isBlank()) {
            table = JdbcVersionApplier.DEFAULT_TABLE;
        }
        if (logLevel == null) {
            logLevel = Level.INFO;
        }
    }
}
