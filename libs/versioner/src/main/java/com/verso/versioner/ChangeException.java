package com.verso.versioner;

/** A {@link Version}'s upgrade or rollback action failed. */
public class ChangeException extends VersionerException {

    private final int versionNumber;

    public ChangeException(int versionNumber, String message) {
        super(message);
        this.versionNumber = versionNumber;
    }

    public ChangeException(int versionNumber, String message, Throwable cause) {
        super(message, cause);
        this.versionNumber = versionNumber;
    }

    /** Number of the version whose action failed. */
    public int versionNumber() {
        return versionNumber;
    }
}
