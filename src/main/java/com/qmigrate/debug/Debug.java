package com.qmigrate.debug;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide diagnostics hub for the parser, the scope tree, the condition
 * simplifier and the loader.
 *
 * Components log through {@code Debug.get()} with a dotted tag
 * ("qmigrate.include"). Nothing is printed until a sink is installed; the CLI
 * installs a {@link StdStreamDebugSink}, tests install capturing lambdas.
 * Messages that are costly to build (scope dumps, per-condition traces) go
 * through the {@link Supplier} overloads and are only built when the sink
 * accepts their level.
 */
public final class Debug {

    private static final DebugSink SILENT = new DebugSink() {
        @Override
        public void log(DebugLevel level, String tag, String message, Throwable error) {
            // dropped
        }

        @Override
        public boolean accepts(DebugLevel level) {
            return false;
        }
    };

    // declared after SILENT: static initializers run in source order
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sink = new AtomicReference<>(SILENT);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs sink; null restores the silent default. */
    public void setSink(DebugSink sink) {
        this.sink.set(sink == null ? SILENT : sink);
    }

    public DebugSink getSink() {
        return sink.get();
    }

    public boolean isEnabled(DebugLevel level) {
        return sink.get().accepts(level);
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void t(String tag, Supplier<String> msg) { lazy(DebugLevel.TRACE, tag, msg); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void d(String tag, Supplier<String> msg) { lazy(DebugLevel.DEBUG, tag, msg); }
    public void i(String tag, String msg) { log(DebugLevel.INFO, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        DebugSink s = sink.get();
        if (s.accepts(level)) {
            s.log(level, tag, message, error);
        }
    }

    private void lazy(DebugLevel level, String tag, Supplier<String> msg) {
        DebugSink s = sink.get();
        if (s.accepts(level)) {
            s.log(level, tag, msg.get(), null);
        }
    }
}
