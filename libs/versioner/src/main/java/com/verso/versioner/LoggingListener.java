package com.verso.versioner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Logs the progress of a sync through SLF4J.
 *
 * <p>Only before-sync, before-change, after-change and after-sync are logged; failures are left to
 * the caller, which receives them as a {@link SyncException}. Never vetoes.
 */
public final class LoggingListener implements SyncListener {

    private final Logger logger;
    private final Level level;

    /** Logs at DEBUG through this class's logger. */
    public LoggingListener() {
        this(LoggerFactory.getLogger(LoggingListener.class), Level.DEBUG);
    }

    /**
     * Logs at the given level through this class's logger.
     *
     * @param level level of every line written
     */
    public LoggingListener(Level level) {
        this(LoggerFactory.getLogger(LoggingListener.class), level);
    }

    /**
     * @param logger logger to write to
     * @param level level of every line written
     */
    public LoggingListener(Logger logger, Level level) {
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        this.logger = logger;
        this.level = level;
    }

    @Override
    public void on(SyncEvent event) {
        switch (event.type()) {
            case BEFORE_SYNC -> logger.atLevel(level).log("starting syncing process");
            case BEFORE_CHANGE ->
                    logger.atLevel(level).log("applying version {}", event.version().number());
            case AFTER_CHANGE ->
                    logger.atLevel(level).log("version {} applied", event.version().number());
            case AFTER_SYNC -> logger.atLevel(level).log("end of syncing process");
            default -> {
                // other events are not logged
            }
        }
    }

    public Level level() {
        return level;
    }
}
