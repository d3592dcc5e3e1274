package com.verso.observability;

import com.verso.versioner.SyncEvent;
import com.verso.versioner.SyncListener;
import com.verso.versioner.VersionApplier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes sync activity as Micrometer meters.
 *
 * <ul>
 *   <li>{@value #SYNCS}: syncs started
 *   <li>{@value #CHANGES_APPLIED}: versions applied and recorded
 *   <li>{@value #CHANGES_FAILED}: versions whose action or marker failed
 *   <li>{@value #SYNC_ERRORS}: syncs that could not read the current version
 *   <li>{@value #CHANGE_DURATION}: time from before-change to after-change
 *   <li>{@value #LAST_APPLIED}: number of the last version applied, -1 until then
 * </ul>
 *
 * <p>Never vetoes. One instance per versioner: the in-flight change timer is single-slot.
 */
public final class MetricsSyncListener implements SyncListener {

    public static final String SYNCS = "versioner.syncs";
    public static final String CHANGES_APPLIED = "versioner.changes.applied";
    public static final String CHANGES_FAILED = "versioner.changes.failed";
    public static final String SYNC_ERRORS = "versioner.sync.errors";
    public static final String CHANGE_DURATION = "versioner.change.duration";
    public static final String LAST_APPLIED = "versioner.version.last.applied";

    private final MetricFactory metrics;
    private final Counter syncs;
    private final Counter changesApplied;
    private final Counter changesFailed;
    private final Counter syncErrors;
    private final Timer changeDuration;
    private final AtomicLong lastApplied;
    private Timer.Sample inFlight;

    public MetricsSyncListener(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
        this.syncs = metrics.counter(SYNCS, "Number of syncs started");
        this.changesApplied = metrics.counter(CHANGES_APPLIED, "Number of versions applied");
        this.changesFailed = metrics.counter(CHANGES_FAILED, "Number of versions that failed");
        this.syncErrors =
                metrics.counter(SYNC_ERRORS, "Number of syncs that could not read the version");
        this.changeDuration = metrics.timer(CHANGE_DURATION, "Time spent applying one version");
        this.lastApplied =
                metrics.gauge(
                        LAST_APPLIED, "Last version applied", VersionApplier.UNVERSIONED);
    }

    @Override
    public void on(SyncEvent event) {
        switch (event.type()) {
            case START -> syncs.increment();
            case BEFORE_CHANGE -> inFlight = Timer.start(metrics.registry());
            case AFTER_CHANGE -> {
                stopTimer();
                changesApplied.increment();
                lastApplied.set(event.version().number());
            }
            case ERROR_DURING_CHANGE -> {
                inFlight = null;
                changesFailed.increment();
            }
            case ERROR -> syncErrors.increment();
            default -> {
                // not measured
            }
        }
    }

    private void stopTimer() {
        if (inFlight != null) {
            inFlight.stop(changeDuration);
            inFlight = null;
        }
    }
}
