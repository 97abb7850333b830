package com.pascalite.debug;

import java.io.PrintStream;

/** Writes records at or above a minimum level to a stream, one line each. */
public final class PrintStreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public PrintStreamDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.DEBUG : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        synchronized (out) {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
