package com.pascalite.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide debug hub shared by the lexer, parser, code generator,
 * stack machine and CLI.
 *
 * Messages are tagged by stage ({@code pascalite.lexer}, {@code pascalite.vm}, ...)
 * and go to whichever {@link DebugSink} is installed. Until one is installed
 * every call is a no-op, so stages may log unconditionally.
 */
public final class Debug {

    // Must be initialised before INSTANCE: the constructor reads it.
    private static final DebugSink SILENT = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sink = new AtomicReference<>(SILENT);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code sink}; null restores the silent default. */
    public void setSink(DebugSink sink) {
        this.sink.set(sink == null ? SILENT : sink);
    }

    public DebugSink getSink() {
        return sink.get();
    }

    /** True when a real sink is installed, so callers can skip building costly trace messages. */
    public boolean enabled() {
        return sink.get() != SILENT;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sink.get().log(level, tag, message, error);
    }
}
