package com.coinscript.debug;

import java.io.PrintStream;

/** Writes "LEVEL tag: message" lines to a stream, dropping anything below the minimum level. */
public final class StreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minimum;

    public StreamDebugSink(PrintStream out, DebugLevel minimum) {
        this.out = out;
        this.minimum = minimum == null ? DebugLevel.TRACE : minimum;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minimum.ordinal()) return;
        out.println(level + " " + tag + ": " + message);
        if (error != null) {
            error.printStackTrace(out);
        }
    }
}
