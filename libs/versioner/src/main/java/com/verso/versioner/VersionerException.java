package com.verso.versioner;

/**
 * Base of every failure raised by the versioner and its collaborators.
 *
 * <p>Unchecked: a failed change or version read is not something the code around a sync can
 * recover from locally; the caller decides whether to run a fresh sync.
 */
public class VersionerException extends RuntimeException {

    public VersionerException(String message) {
        super(message);
    }

    public VersionerException(String message, Throwable cause) {
        super(message, cause);
    }
}
