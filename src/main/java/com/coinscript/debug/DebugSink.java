package com.coinscript.debug;

/** Pluggable debug output target (stderr, file, test capture, etc.). */
@FunctionalInterface
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
