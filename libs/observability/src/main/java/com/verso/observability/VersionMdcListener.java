package com.verso.observability;

import com.verso.versioner.SyncEvent;
import com.verso.versioner.SyncListener;
import org.slf4j.MDC;

/**
 * Exposes the version being applied through the SLF4J MDC.
 *
 * <p>While a change is in flight the {@value #MDC_SCHEMA_VERSION} key holds its number, so every
 * log statement written by the version's scripts, the applier or other listeners on this thread is
 * tagged with it. The key is removed on after-change and error-during-change, and at start, which
 * clears a key left behind by a sync vetoed mid-change.
 */
public final class VersionMdcListener implements SyncListener {

    /** MDC key holding the number of the version being applied. */
    public static final String MDC_SCHEMA_VERSION = "schemaVersion";

    @Override
    public void on(SyncEvent event) {
        switch (event.type()) {
            case BEFORE_CHANGE ->
                    MDC.put(MDC_SCHEMA_VERSION, String.valueOf(event.version().number()));
            case START, AFTER_CHANGE, ERROR_DURING_CHANGE -> MDC.remove(MDC_SCHEMA_VERSION);
            default -> {
                // key unchanged
            }
        }
    }
}
