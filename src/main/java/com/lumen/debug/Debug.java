package com.lumen.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all Lumen components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 * - Messages below the configured minimum level are dropped before reaching the sink
 */
public final class Debug {

    // Must be initialised before INSTANCE: the constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.TRACE;

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

    public void setMinLevel(DebugLevel level) {
        this.minLevel = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getMinLevel() {
        return minLevel;
    }

    /** Route everything to System.out (errors and warnings to System.err). */
    public static void useSysOut() {
        INSTANCE.setSink((level, tag, message, error) -> {
            PrintStream ps = (level == DebugLevel.WARN || level == DebugLevel.ERROR) ? System.err : System.out;
            ps.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(ps);
        });
    }

    // Convenience methods
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minLevel.ordinal()) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
