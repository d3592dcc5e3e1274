package com.verso.versioner;

/**
 * One lifecycle moment of a sync.
 *
 * @param type what happened
 * @param version the version being changed; only set for before-change, after-change and
 *     error-during-change, null otherwise
 * @param error the failure being reported; only set for error and error-during-change, null
 *     otherwise
 */
public record SyncEvent(EventType type, Version version, Throwable error) {

    public SyncEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    /** Event without version or error payload (start, end, before-sync, after-sync). */
    public static SyncEvent of(EventType type) {
        return new SyncEvent(type, null, null);
    }

    /** Per-change event (before-change, after-change). */
    public static SyncEvent forVersion(EventType type, Version version) {
        if (version == null) {
            throw new IllegalArgumentException("version must not be null");
        }
        return new SyncEvent(type, version, null);
    }

    /** Failure of a change or of its version marker. */
    public static SyncEvent errorDuringChange(Version version, Throwable error) {
        return new SyncEvent(EventType.ERROR_DURING_CHANGE, version, error);
    }

    /** Failure outside any change, such as reading the current version. */
    public static SyncEvent error(Throwable error) {
        return new SyncEvent(EventType.ERROR, null, error);
    }

    public boolean hasVersion() {
        return version != null;
    }

    public boolean hasError() {
        return error != null;
    }
}
