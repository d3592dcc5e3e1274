package com.verso.versioner;

import java.util.Optional;

/**
 * Lifecycle moments a {@link SyncListener} is notified of during {@link Versioner#sync(int)}.
 *
 * <p>The {@code value} strings are the stable names other listeners key on (log lines, metric
 * tags); they never change even if the constants are renamed.
 */
public enum EventType {
    START("start"),
    END("end"),
    BEFORE_SYNC("before-sync"),
    AFTER_SYNC("after-sync"),
    BEFORE_CHANGE("before-change"),
    AFTER_CHANGE("after-change"),
    ERROR_DURING_CHANGE("error-during-change"),
    ERROR("error");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical event name (e.g. "before-change"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical name.
     *
     * @param value the name to match (e.g. "error-during-change")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Whether events of this type carry the {@link Version} being changed. */
    public boolean isChangeEvent() {
        return this == BEFORE_CHANGE || this == AFTER_CHANGE || this == ERROR_DURING_CHANGE;
    }
}
