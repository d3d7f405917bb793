package com.qmigrate.debug;

import java.io.PrintStream;

/**
 * Writes debug lines to stdout, WARN and above to stderr.
 * Lines below the configured threshold are dropped.
 */
public final class StdStreamDebugSink implements DebugSink {

    private final DebugLevel threshold;
    private final PrintStream out;
    private final PrintStream err;

    public StdStreamDebugSink(DebugLevel threshold) {
        this(threshold, System.out, System.err);
    }

    public StdStreamDebugSink(DebugLevel threshold, PrintStream out, PrintStream err) {
        this.threshold = threshold == null ? DebugLevel.INFO : threshold;
        this.out = out;
        this.err = err;
    }

    @Override
    public boolean accepts(DebugLevel level) {
        return level.atLeast(threshold);
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!accepts(level)) return;

        PrintStream target = level.atLeast(DebugLevel.WARN) ? err : out;
        target.println("[" + level + "] " + tag + ": " + message);
        if (error != null) {
            error.printStackTrace(target);
        }
    }
}
