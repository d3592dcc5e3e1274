package com.verso.versioner;

/** Listener that ignores every event. Used when no listener is configured. */
public enum NoOpListener implements SyncListener {
    INSTANCE;

    @Override
    public void on(SyncEvent event) {}
}
