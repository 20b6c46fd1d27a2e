package com.veil.blocklist.activity;

import com.veil.blocklist.api.ActivityLogSink;
import com.veil.blocklist.api.model.BlockDecision;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes block decisions to {@code java.util.logging}.
 */
public final class LoggingActivityLogSink implements ActivityLogSink {
    private static final Logger logger = Logger.getLogger(LoggingActivityLogSink.class.getName());

    private final Level level;

    public LoggingActivityLogSink() {
        this(Level.FINE);
    }

    public LoggingActivityLogSink(Level level) {
        this.level = level;
    }

    @Override
    public void record(BlockDecision decision) {
        if (!logger.isLoggable(level)) {
            return;
        }
        if (decision.blocked()) {
            logger.log(level, String.format("Blocked (%s) %s", decision.reason(), decision.url()));
        } else {
            logger.log(level, "Allowed " + decision.url());
        }
    }
}
