package com.verso.versioner;

/** Phase of a sync in which a {@link SyncException} originated. */
public enum SyncFailure {
    /** The current version could not be read; nothing was changed. */
    READ,
    /** A version's upgrade or rollback failed; earlier versions stay applied. */
    CHANGE,
    /**
     * A version was applied but its marker could not be recorded; the structure and its recorded
     * version now disagree.
     */
    PERSIST,
    /** A listener threw while being notified. */
    LISTENER_VETO
}
