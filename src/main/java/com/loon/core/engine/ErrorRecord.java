package com.loon.core.engine;

/**
 * An error raised by a test body, normalized for reporting.
 *
 * @param message {@code File.java:line: } followed by the error, or just the error when no location is known
 * @param trace   the stack frames between the throw site and the harness, one per line
 */
public record ErrorRecord(String message, String trace) {}
