package com.verso.database.migration;

import com.verso.versioner.SyncPlan;
import com.verso.versioner.Versioner;
import java.util.List;

/**
 * Reports where the schema stands relative to the available versions.
 *
 * <p>A POJO (no Spring annotations): the Spring wiring happens in {@link VersionerConfig}, and tests
 * can build it around any {@link Versioner}. Nothing is changed by asking for a status.
 */
public class VersionStatusService {

    /**
     * Status of the versioned structure.
     *
     * @param currentVersion version recorded by the applier (-1 when never versioned)
     * @param lastVersion highest version available
     * @param targetVersion version the pending list leads to
     * @param direction "upgrade" or "rollback"
     * @param pendingVersions versions a sync to {@code targetVersion} would apply, in order
     */
    public record VersionStatus(
            int currentVersion,
            int lastVersion,
            int targetVersion,
            String direction,
            List<Integer> pendingVersions) {

        public VersionStatus {
            pendingVersions = List.copyOf(pendingVersions);
        }

        public boolean isUpToDate() {
            return currentVersion == targetVersion;
        }
    }

    private final Versioner versioner;

    public VersionStatusService(Versioner versioner) {
        if (versioner == null) {
            throw new IllegalArgumentException("versioner must not be null");
        }
        this.versioner = versioner;
    }

    /** Status relative to the last available version. */
    public VersionStatus status() {
        return status(versioner.lastVersion());
    }

    /**
     * Status relative to {@code targetVersion}.
     *
     * @param targetVersion version to compare against
     * @return the status
     */
    public VersionStatus status(int targetVersion) {
        SyncPlan plan = versioner.plan(targetVersion);
        return new VersionStatus(
                plan.currentVersion(),
                versioner.lastVersion(),
                targetVersion,
                plan.direction().label(),
                plan.versionNumbers());
    }
}
