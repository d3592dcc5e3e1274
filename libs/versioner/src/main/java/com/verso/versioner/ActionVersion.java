package com.verso.versioner;

/** {@link Version} backed by two {@link Runnable}s. Created through {@link Version#of}. */
record ActionVersion(int number, Runnable upgradeAction, Runnable rollbackAction)
        implements Version {

    @Override
    public void upgrade() {
        run(upgradeAction, "upgrade");
    }

    @Override
    public void rollback() {
        run(rollbackAction, "rollback");
    }

    private void run(Runnable action, String kind) {
        try {
            action.run();
        } catch (ChangeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ChangeException(number, kind + " of version " + number + " failed", e);
        }
    }

    @Override
    public String toString() {
        return "Version[" + number + "]";
    }
}
