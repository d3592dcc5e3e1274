package com.verso.versioner;

import java.util.List;

/**
 * Forwards every event to an ordered list of listeners.
 *
 * <p>The first listener that throws stops the broadcast: its failure propagates and the listeners
 * after it never see that event.
 */
public final class BroadcastListener implements SyncListener {

    private final List<SyncListener> listeners;

    /**
     * Creates a broadcast over the given listeners, in invocation order.
     *
     * @param listeners the listeners to notify
     */
    public BroadcastListener(List<? extends SyncListener> listeners) {
        if (listeners == null) {
            throw new IllegalArgumentException("listeners must not be null");
        }
        this.listeners = List.copyOf(listeners);
    }

    public static BroadcastListener of(SyncListener... listeners) {
        return new BroadcastListener(List.of(listeners));
    }

    @Override
    public void on(SyncEvent event) {
        for (SyncListener listener : listeners) {
            listener.on(event);
        }
    }

    /** The listeners notified, in order. */
    public List<SyncListener> listeners() {
        return listeners;
    }
}
