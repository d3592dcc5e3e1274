package com.verso.versioner;

/**
 * Thrown by {@link Version#rollback()} when the change has no meaningful inverse, such as the
 * bootstrap change creating the version tracking itself.
 *
 * <p>The {@link Versioner} reports it like any other {@link ChangeException}.
 */
public class RollbackUnsupportedException extends ChangeException {

    public RollbackUnsupportedException(int versionNumber) {
        super(versionNumber, "cannot rollback version " + versionNumber);
    }
}
