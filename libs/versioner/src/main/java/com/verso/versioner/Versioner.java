package com.verso.versioner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a versioned structure to a target version by applying the {@link Version}s that lie
 * between its current and target versions.
 *
 * <h2>Selection</h2>
 *
 * <p>Only versions <em>strictly</em> between current and target move. Upgrading from {@code c} to
 * {@code t} applies every version with {@code c < number < t} in ascending order; rolling back
 * applies every version with {@code t < number < c} in descending order. The version numbered
 * like the current version counts as already applied and the one numbered like the target is never
 * run.
 *
 * <h2>Events</h2>
 *
 * <pre>
 * start
 *   [current == target] end
 *   before-sync
 *     before-change(v) -> action -> syncVersion -> after-change(v)   (per version)
 *     error-during-change(v, e)                                     (on action/marker failure)
 *   after-sync
 * end
 * </pre>
 *
 * <p>{@code error} is raised when the current version cannot be read. A listener throwing at any
 * point aborts the sync.
 *
 * <h2>Failures</h2>
 *
 * <p>Nothing is retried. Versions applied before a failure stay applied and recorded; wrap each
 * change in a transaction with a listener if that is not acceptable. Every failure surfaces as a
 * {@link SyncException}.
 *
 * <p>Not thread-safe. Concurrent syncs against the same structure must be coordinated by the
 * caller.
 */
public class Versioner {

    private static final Logger log = LoggerFactory.getLogger(Versioner.class);

    private static final Comparator<Version> BY_NUMBER = Comparator.comparingInt(Version::number);

    private final VersionApplier applier;
    private final List<Version> versions;
    private SyncListener listener;

    /**
     * Creates a versioner without any listener.
     *
     * @param applier the structure to version; shared, its lifecycle stays with the caller
     * @param versions the available versions, in any order
     */
    public Versioner(VersionApplier applier, Collection<? extends Version> versions) {
        this(applier, versions, NoOpListener.INSTANCE);
    }

    /**
     * @param applier the structure to version; shared, its lifecycle stays with the caller
     * @param versions the available versions, in any order
     * @param listener listener notified of every event; null means {@link NoOpListener}
     */
    public Versioner(
            VersionApplier applier,
            Collection<? extends Version> versions,
            SyncListener listener) {
        if (applier == null) {
            throw new IllegalArgumentException("applier must not be null");
        }
        if (versions == null) {
            throw new IllegalArgumentException("versions must not be null");
        }
        this.applier = applier;
        this.versions = new ArrayList<>(versions);
        setListener(listener);
    }

    /**
     * Returns the structure's current version without changing anything.
     *
     * @throws VersionStoreException if the applier cannot read it
     */
    public int currentVersion() {
        return applier.currentVersion();
    }

    /** Highest version number available, or 0 when there are no versions. */
    public int lastVersion() {
        int last = 0;
        for (Version version : versions) {
            last = Math.max(last, version.number());
        }
        return last;
    }

    /**
     * Upgrades the structure to {@link #lastVersion()}.
     *
     * @throws SyncException if the sync fails
     */
    public void upgradeToLast() {
        sync(lastVersion());
    }

    /**
     * Computes what {@link #sync(int)} would apply, without emitting events or running anything.
     *
     * @param targetVersion version to reach
     * @return the plan
     * @throws VersionStoreException if the applier cannot read the current version
     */
    public SyncPlan plan(int targetVersion) {
        int currentVersion = applier.currentVersion();
        if (currentVersion == targetVersion) {
            return SyncPlan.upToDate(currentVersion);
        }
        versions.sort(BY_NUMBER);
        Direction direction = Direction.between(currentVersion, targetVersion);
        return new SyncPlan(
                currentVersion,
                targetVersion,
                direction,
                select(direction, currentVersion, targetVersion));
    }

    /**
     * Syncs the structure to {@code targetVersion}.
     *
     * @param targetVersion version to reach
     * @throws SyncException if reading the current version, a change, recording a version or a
     *     listener fails
     */
    public void sync(int targetVersion) {
        emit(SyncEvent.of(EventType.START));

        int currentVersion;
        try {
            currentVersion = applier.currentVersion();
        } catch (RuntimeException e) {
            throw report(SyncFailure.READ, SyncEvent.error(e), "could not sync", e);
        }

        if (currentVersion == targetVersion) {
            log.debug("Structure already at version {}", currentVersion);
            emit(SyncEvent.of(EventType.END));
            return;
        }

        versions.sort(BY_NUMBER);
        Direction direction = Direction.between(currentVersion, targetVersion);
        List<Version> toApply = select(direction, currentVersion, targetVersion);
        log.debug(
                "Syncing from version {} to {}: {} of {} version(s)",
                currentVersion,
                targetVersion,
                direction.label(),
                toApply.size());

        emit(SyncEvent.of(EventType.BEFORE_SYNC));
        for (Version version : toApply) {
            apply(direction, version);
        }
        emit(SyncEvent.of(EventType.AFTER_SYNC));

        emit(SyncEvent.of(EventType.END));
    }

    private void apply(Direction direction, Version version) {
        emit(SyncEvent.forVersion(EventType.BEFORE_CHANGE, version));

        int number = version.number();
        try {
            direction.apply(version);
        } catch (RuntimeException e) {
            throw report(
                    SyncFailure.CHANGE,
                    SyncEvent.errorDuringChange(version, e),
                    direction.label() + " to version " + number,
                    e);
        }

        try {
            applier.syncVersion(number);
        } catch (RuntimeException e) {
            throw report(
                    SyncFailure.PERSIST,
                    SyncEvent.errorDuringChange(version, e),
                    "sync version to " + number,
                    e);
        }

        emit(SyncEvent.forVersion(EventType.AFTER_CHANGE, version));
    }

    private List<Version> select(Direction direction, int currentVersion, int targetVersion) {
        List<Version> selected = new ArrayList<>();
        for (Version version : versions) {
            int number = version.number();
            if (direction == Direction.UPGRADE) {
                if (number > currentVersion && number < targetVersion) {
                    selected.add(version);
                }
            } else if (number < currentVersion && number > targetVersion) {
                selected.add(0, version);
            }
        }
        return selected;
    }

    private void emit(SyncEvent event) {
        try {
            listener.on(event);
        } catch (RuntimeException e) {
            throw SyncException.veto(event, e);
        }
    }

    /** Notifies the listener of a failure; a listener failure here is folded into the result. */
    private SyncException report(
            SyncFailure failure, SyncEvent event, String context, RuntimeException cause) {
        try {
            listener.on(event);
        } catch (RuntimeException listenerError) {
            return SyncException.of(failure, event, context, cause, listenerError);
        }
        return SyncException.of(failure, event, context, cause, null);
    }

    public VersionApplier applier() {
        return applier;
    }

    /** The held versions; sorted by number after the first sync or plan. */
    public List<Version> versions() {
        return Collections.unmodifiableList(versions);
    }

    public SyncListener listener() {
        return listener;
    }

    /**
     * Replaces the listener.
     *
     * @param listener new listener; null means {@link NoOpListener}
     */
    public void setListener(SyncListener listener) {
        this.listener = listener == null ? NoOpListener.INSTANCE : listener;
    }
}
