package com.qmigrate.debug;

/**
 * Receives the lines logged through {@link Debug}. A lambda is enough for a
 * sink that takes everything.
 */
@FunctionalInterface
public interface DebugSink {

    void log(DebugLevel level, String tag, String message, Throwable error);

    /** Lines below the sink's threshold are neither built nor passed to log. */
    default boolean accepts(DebugLevel level) {
        return true;
    }
}
