package com.verso.versioner;

/**
 * Observer of sync lifecycle events.
 *
 * <p>Throwing from {@link #on(SyncEvent)} is a veto: the {@link Versioner} stops the sync right
 * away and rethrows the failure wrapped in a {@link SyncException} naming the event. There is no
 * other cancellation mechanism.
 *
 * <p>Compose several listeners with {@link BroadcastListener} rather than subclassing.
 */
@FunctionalInterface
public interface SyncListener {

    /**
     * Reacts to an event.
     *
     * @param event the event being raised
     * @throws RuntimeException to abort the sync
     */
    void on(SyncEvent event);
}
