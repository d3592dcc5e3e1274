package com.verso.versioner;

/**
 * The structure being versioned, as seen by the {@link Versioner}: it reports the version it
 * currently records and persists a new marker after each successful change.
 *
 * <p>Backends are free to store the marker however they like (an append-only table, a single
 * mutable row, a key-value entry) as long as {@link #currentVersion()} always reflects the last
 * successful {@link #syncVersion(int)}. The engine never caches the value across calls.
 */
public interface VersionApplier {

    /** Returned by {@link #currentVersion()} when no version was ever recorded. */
    int UNVERSIONED = -1;

    /**
     * Returns the version currently recorded for the structure.
     *
     * @return the recorded version, or {@link #UNVERSIONED} for a pristine structure (which is not
     *     the same as the explicit baseline {@code 0})
     * @throws VersionStoreException if the version could not be read
     */
    int currentVersion();

    /**
     * Durably records {@code versionNumber} as the structure's current version.
     *
     * @param versionNumber the version that was just applied or rolled back
     * @throws VersionStoreException if the marker could not be written
     */
    void syncVersion(int versionNumber);
}
