package com.verso.versioner;

import java.util.List;

/**
 * What {@link Versioner#sync(int)} would do for a target, computed without running anything.
 *
 * @param currentVersion version recorded by the applier when the plan was made
 * @param targetVersion version asked for
 * @param direction upgrade or rollback; upgrade when already up to date
 * @param versions versions to apply, in application order
 */
public record SyncPlan(
        int currentVersion, int targetVersion, Direction direction, List<Version> versions) {

    public SyncPlan {
        versions = List.copyOf(versions);
    }

    /** Plan for a structure already at {@code version}. */
    public static SyncPlan upToDate(int version) {
        return new SyncPlan(version, version, Direction.UPGRADE, List.of());
    }

    /** True when current and target match, in which case sync is a no-op. */
    public boolean isUpToDate() {
        return currentVersion == targetVersion;
    }

    /** Numbers of the versions to apply, in application order. */
    public List<Integer> versionNumbers() {
        return versions.stream().map(Version::number).toList();
    }
}
