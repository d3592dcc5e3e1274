package com.verso.database.migration;

import com.verso.database.TransactionalChangesListener;
import com.verso.versioner.SyncException;
import com.verso.versioner.Versioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Syncs the schema when the application starts.
 *
 * <p>A failed sync is logged and rethrown, which stops the application: a service must not run
 * against a schema it was not built for. Any transaction left open by the failure is rolled back
 * before the exception leaves.
 */
public class VersionerRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(VersionerRunner.class);

    private final Versioner versioner;
    private final Integer targetVersion;
    private final TransactionalChangesListener transactions;

    /**
     * @param versioner the versioner to run
     * @param targetVersion version to reach; null means the last available version
     * @param transactions transaction listener to release on exit
     */
    public VersionerRunner(
            Versioner versioner,
            Integer targetVersion,
            TransactionalChangesListener transactions) {
        if (versioner == null) {
            throw new IllegalArgumentException("versioner must not be null");
        }
        if (transactions == null) {
            throw new IllegalArgumentException("transactions must not be null");
        }
        this.versioner = versioner;
        this.targetVersion = targetVersion;
        this.transactions = transactions;
    }

    @Override
    public void run(ApplicationArguments args) {
        sync();
    }

    /**
     * Runs the sync.
     *
     * @return the version the structure ended at
     * @throws SyncException if the sync fails
     */
    public int sync() {
        int target = targetVersion != null ? targetVersion : versioner.lastVersion();
        log.info("Syncing schema towards version {}", target);
        try (transactions) {
            versioner.sync(target);
        } catch (SyncException e) {
            log.error(
                    "Schema sync towards version {} failed ({})",
                    target,
                    e.failure(),
                    e);
            throw e;
        }
        int current = versioner.currentVersion();
        log.info("Schema is at version {}", current);
        return current;
    }
}
