package com.verso.versioner;

/**
 * A numbered change unit that knows how to move a structure forward ({@link #upgrade()}) and back
 * ({@link #rollback()}).
 *
 * <p>Version numbers don't need to be contiguous, but the higher the number the more up-to-date the
 * structure is. {@code 0} is the empty baseline; the bootstrap change that creates the version
 * tracking itself usually takes it.
 *
 * <p>Implementations are immutable: the {@link Versioner} calls {@link #number()} repeatedly while
 * ordering and selecting, and expects the same answer every time.
 */
public interface Version {

    /** Ordering key and identifier of this change. Must not have side effects. */
    int number();

    /**
     * Applies the forward change.
     *
     * @throws ChangeException if the change could not be applied
     */
    void upgrade();

    /**
     * Applies the inverse change.
     *
     * @throws RollbackUnsupportedException if this change has no meaningful inverse
     * @throws ChangeException if the inverse change could not be applied
     */
    void rollback();

    /**
     * Builds a version from two plain actions. Any {@link RuntimeException} thrown by an action is
     * reported as a {@link ChangeException}.
     *
     * @param number version number
     * @param upgrade forward action
     * @param rollback inverse action
     * @return the version
     */
    static Version of(int number, Runnable upgrade, Runnable rollback) {
        if (upgrade == null) {
            throw new IllegalArgumentException("upgrade must not be null");
        }
        if (rollback == null) {
            throw new IllegalArgumentException("rollback must not be null");
        }
        return new ActionVersion(number, upgrade, rollback);
    }

    /**
     * Builds a version that can only move forward; its rollback always throws {@link
     * RollbackUnsupportedException}.
     *
     * @param number version number
     * @param upgrade forward action
     * @return the version
     */
    static Version irreversible(int number, Runnable upgrade) {
        return of(
                number,
                upgrade,
                () -> {
                    throw new RollbackUnsupportedException(number);
                });
    }
}
