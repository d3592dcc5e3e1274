package com.verso.versioner;

/** Which way a sync moves the structure. */
public enum Direction {
    UPGRADE("upgrade") {
        @Override
        void apply(Version version) {
            version.upgrade();
        }
    },
    ROLLBACK("rollback") {
        @Override
        void apply(Version version) {
            version.rollback();
        }
    };

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    /**
     * Rollback iff the target lies below the current version, upgrade otherwise.
     *
     * @param currentVersion version recorded by the applier
     * @param targetVersion version asked for
     */
    public static Direction between(int currentVersion, int targetVersion) {
        return targetVersion < currentVersion ? ROLLBACK : UPGRADE;
    }

    /** Runs the matching action of {@code version}. */
    abstract void apply(Version version);

    /** Lower-case name used in messages and metric tags. */
    public String label() {
        return label;
    }
}
