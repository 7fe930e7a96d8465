package com.coinscript.debug;

/** Severity of a debug message, ordered from most to least verbose. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
