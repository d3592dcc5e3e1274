package com.verso.versioner;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * The single failure a {@link Versioner#sync(int)} call ends with.
 *
 * <p>The cause is the root failure (applier, version action or listener). When a listener also
 * failed while that failure was being reported, both are kept: the original stays the cause and
 * the listener's failure is available through {@link #listenerError()} and as a suppressed
 * exception.
 */
public class SyncException extends VersionerException {

    private final SyncFailure failure;
    private final EventType eventType;
    private final Integer versionNumber;
    private final Throwable listenerError;

    public SyncException(
            SyncFailure failure,
            EventType eventType,
            Integer versionNumber,
            String message,
            Throwable cause,
            Throwable listenerError) {
        super(message, cause);
        this.failure = failure;
        this.eventType = eventType;
        this.versionNumber = versionNumber;
        this.listenerError = listenerError;
        if (listenerError != null && listenerError != cause) {
            addSuppressed(listenerError);
        }
    }

    /** Listener failure on a plain notification. */
    static SyncException veto(SyncEvent event, RuntimeException listenerError) {
        return new SyncException(
                SyncFailure.LISTENER_VETO,
                event.type(),
                event.hasVersion() ? event.version().number() : null,
                "event " + event.type().value() + ": " + listenerError.getMessage(),
                listenerError,
                null);
    }

    /**
     * Failure of a sync step, possibly followed by a listener failure while reporting it.
     *
     * @param failure phase of the failure
     * @param reported the error or error-during-change event raised for it
     * @param context what was being done (e.g. "upgrade to version 2")
     * @param cause the step's failure
     * @param listenerError listener failure while reporting, or null
     */
    static SyncException of(
            SyncFailure failure,
            SyncEvent reported,
            String context,
            RuntimeException cause,
            RuntimeException listenerError) {
        String message =
                listenerError == null
                        ? context + ": " + cause.getMessage()
                        : context
                                + " (event error: "
                                + listenerError.getMessage()
                                + "): "
                                + cause.getMessage();
        return new SyncException(
                failure,
                listenerError == null ? null : reported.type(),
                reported.hasVersion() ? reported.version().number() : null,
                message,
                cause,
                listenerError);
    }

    public SyncFailure failure() {
        return failure;
    }

    /**
     * The event during which a listener failed, if one did. For {@link SyncFailure#LISTENER_VETO}
     * this is the vetoed event; for other failures it is the error event whose listener failed.
     */
    public Optional<EventType> eventType() {
        return Optional.ofNullable(eventType);
    }

    /** Number of the version being changed when the sync failed, if any. */
    public OptionalInt versionNumber() {
        return versionNumber == null ? OptionalInt.empty() : OptionalInt.of(versionNumber);
    }

    /** Failure of a listener while another failure was being reported, if any. */
    public Optional<Throwable> listenerError() {
        return Optional.ofNullable(listenerError);
    }
}
