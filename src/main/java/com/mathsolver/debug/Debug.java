package com.mathsolver.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the solver engine.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No output unless a sink is installed
 */
public final class Debug {

    // must be initialised before INSTANCE, whose sinkRef starts out pointing at it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Sink writing one line per message to the given stream, dropping anything below minLevel. */
    public static DebugSink streamSink(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.isAtLeast(minLevel)) return;
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void w(String tag, String msg, Throwable err) { log(DebugLevel.WARN, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
