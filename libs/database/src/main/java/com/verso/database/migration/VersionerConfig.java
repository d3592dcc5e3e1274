package com.verso.database.migration;

import com.verso.database.ConnectionSource;
import com.verso.database.JdbcVersionApplier;
import com.verso.database.TransactionalChangesListener;
import com.verso.database.VersionTableVersion;
import com.verso.observability.MetricFactory;
import com.verso.observability.MetricsSyncListener;
import com.verso.observability.TracingSyncListener;
import com.verso.observability.VersionMdcListener;
import com.verso.versioner.BroadcastListener;
import com.verso.versioner.LoggingListener;
import com.verso.versioner.SyncListener;
import com.verso.versioner.Version;
import com.verso.versioner.Versioner;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for a JDBC schema versioner that syncs at startup.
 *
 * <p>WHY: Services own their schema. Instead of sharing the application's pooled data source, the
 * versioner gets a dedicated one from {@link VersionerProperties}, so it can run with a schema-owner
 * account while the application uses a restricted one. That data source is never published as a
 * bean: a context-visible {@link DataSource} would stop Spring Boot from creating the application's
 * own {@code spring.datasource}.
 *
 * <h2>Beans</h2>
 *
 * <ul>
 *   <li>{@link #TRANSACTIONS_BEAN}: connection source over the versioner's data source, also the
 *       per-change transaction listener (in the chain only when {@code transactional=true})
 *   <li>{@link #VERSIONER_BEAN}: the versioner: version table bootstrap (version 0) + scripts
 *   <li>{@link VersionerRunner}: runs the sync on {@code ApplicationRunner}
 *   <li>{@link VersionStatusService}: read-only status
 * </ul>
 *
 * <p>Activated by {@code verso.versioner.enabled=true}.
 *
 * @see VersionerProperties
 */
@Configuration
@EnableConfigurationProperties(VersionerProperties.class)
@ConditionalOnProperty(prefix = "verso.versioner", name = "enabled", havingValue = "true")
public class VersionerConfig {

    /** Bean name of the transaction listener. */
    public static final String TRANSACTIONS_BEAN = "versionerTransactions";

    /** Bean name of the versioner. */
    public static final String VERSIONER_BEAN = "schemaVersioner";

    /** Value of the {@code structure} tag on the versioner's metrics. */
    public static final String METRICS_STRUCTURE = "schema";

    /** Instrumentation scope of the versioner's spans. */
    public static final String TRACER_NAME = "com.verso.versioner";

    /**
     * Creates the connection source of the versioned database.
     *
     * <p>Outside a change it hands out plain connections, so it also serves a non-transactional
     * versioner.
     *
     * @param properties externalized configuration
     * @return transaction listener over a data source private to the versioner
     */
    @Bean(name = TRANSACTIONS_BEAN)
    public TransactionalChangesListener versionerTransactions(VersionerProperties properties) {
        return new TransactionalChangesListener(dataSource(properties));
    }

    /**
     * Creates the versioner.
     *
     * <p>The applier and scripts always run on the transaction listener. With {@code
     * transactional=true} it is also in the listener chain, so a script and its version row commit
     * together; otherwise each unit of work gets its own connection.
     *
     * @param properties externalized configuration
     * @param transactions connection source and transaction listener
     * @param meterRegistry registry for the sync metrics, if the application has one
     * @param openTelemetry SDK for the sync spans, if the application has one
     * @return the versioner
     */
    @Bean(name = VERSIONER_BEAN)
    public Versioner schemaVersioner(
            VersionerProperties properties,
            @Qualifier(TRANSACTIONS_BEAN) TransactionalChangesListener transactions,
            ObjectProvider<MeterRegistry> meterRegistry,
            ObjectProvider<OpenTelemetry> openTelemetry) {
        JdbcVersionApplier applier = new JdbcVersionApplier(transactions, properties.table());
        List<Version> versions = versions(properties, transactions);

        List<SyncListener> listeners = new ArrayList<>();
        if (properties.transactional()) {
            listeners.add(transactions);
        }
        listeners.add(new LoggingListener(properties.logLevel()));
        listeners.add(new VersionMdcListener());
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null) {
            listeners.add(new MetricsSyncListener(new MetricFactory(registry, METRICS_STRUCTURE)));
        }
        openTelemetry.ifAvailable(
                otel -> listeners.add(new TracingSyncListener(otel.getTracer(TRACER_NAME))));

        return new Versioner(applier, versions, new BroadcastListener(listeners));
    }

    @Bean
    public VersionerRunner versionerRunner(
            @Qualifier(VERSIONER_BEAN) Versioner versioner,
            VersionerProperties properties,
            @Qualifier(TRANSACTIONS_BEAN) TransactionalChangesListener transactions) {
        return new VersionerRunner(versioner, properties.targetVersion(), transactions);
    }

    @Bean
    public VersionStatusService versionStatusService(
            @Qualifier(VERSIONER_BEAN) Versioner versioner) {
        return new VersionStatusService(versioner);
    }

    // ── Private Helpers ──

    private static DataSource dataSource(VersionerProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    /** Version table bootstrap first, then the scripts found in the configured location. */
    static List<Version> versions(VersionerProperties properties, ConnectionSource connections) {
        List<Version> scripts = ClasspathScriptVersions.load(properties.locations(), connections);
        for (Version script : scripts) {
            if (script.number() == VersionTableVersion.DEFAULT_NUMBER) {
                throw new IllegalStateException(
                        "version "
                                + VersionTableVersion.DEFAULT_NUMBER
                                + " is reserved for the version table, rename "
                                + script);
            }
        }
        List<Version> versions = new ArrayList<>();
        versions.add(
                new VersionTableVersion(
                        connections, VersionTableVersion.DEFAULT_NUMBER, properties.table()));
        versions.addAll(scripts);
        return versions;
    }
}
