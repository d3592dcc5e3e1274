package com.verso.versioner;

/** A {@link VersionApplier} could not read or record the structure's version. */
public class VersionStoreException extends VersionerException {

    public VersionStoreException(String message) {
        super(message);
    }

    public VersionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
