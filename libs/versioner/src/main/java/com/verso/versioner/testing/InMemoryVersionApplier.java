package com.verso.versioner.testing;

import com.verso.versioner.VersionApplier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link VersionApplier} for unit tests.
 *
 * <p>Records every synced version in order and can be told to fail reads or the recording of a
 * given version, so tests can drive every failure path of a sync without a database.
 *
 * <pre>{@code
 * var applier = new InMemoryVersionApplier(1);
 * applier.failSyncOf(3, new VersionStoreException("disk full"));
 * }</pre>
 */
public final class InMemoryVersionApplier implements VersionApplier {

    private int current;
    private final List<Integer> history = new ArrayList<>();
    private final Map<Integer, RuntimeException> syncFailures = new HashMap<>();
    private RuntimeException readFailure;
    private int reads;

    /** Starts unversioned. */
    public InMemoryVersionApplier() {
        this(UNVERSIONED);
    }

    /**
     * @param initialVersion version reported before any sync
     */
    public InMemoryVersionApplier(int initialVersion) {
        this.current = initialVersion;
    }

    @Override
    public int currentVersion() {
        reads++;
        if (readFailure != null) {
            throw readFailure;
        }
        return current;
    }

    @Override
    public void syncVersion(int versionNumber) {
        RuntimeException failure = syncFailures.get(versionNumber);
        if (failure != null) {
            throw failure;
        }
        history.add(versionNumber);
        current = versionNumber;
    }

    /** Makes every subsequent {@link #currentVersion()} throw {@code failure}. */
    public InMemoryVersionApplier failReadsWith(RuntimeException failure) {
        this.readFailure = failure;
        return this;
    }

    /** Makes {@link #syncVersion(int)} throw {@code failure} for {@code versionNumber}. */
    public InMemoryVersionApplier failSyncOf(int versionNumber, RuntimeException failure) {
        syncFailures.put(versionNumber, failure);
        return this;
    }

    /** Version recorded last, without counting as a read. */
    public int version() {
        return current;
    }

    /** Every version recorded so far, in recording order. */
    public List<Integer> history() {
        return List.copyOf(history);
    }

    /** Number of {@link #currentVersion()} calls. */
    public int reads() {
        return reads;
    }
}
