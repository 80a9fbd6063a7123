package io.crashreport.sdk.model;

import java.util.Objects;

/**
 * Describes an error attached to an {@link Event}.
 *
 * <p>Encoded on the wire as {@code {"type": ..., "value": ...}}. Use {@link #of(Throwable)}
 * for Java exceptions, or implement this interface to report errors that are not throwables.
 */
public interface ExceptionInfo {

    /** Name of the error type, e.g. {@code java.lang.IllegalStateException}. */
    String getType();

    /** Human-readable description of this particular error. */
    String getValue();

    /** Adapt a throwable: its class name and its message (or {@code toString()} when it has none). */
    static ExceptionInfo of(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable");
        String type = throwable.getClass().getName();
        String value = throwable.getMessage() != null ? throwable.getMessage() : throwable.toString();
        return of(type, value);
    }

    static ExceptionInfo of(String type, String value) {
        return new ExceptionInfo() {
            @Override public String getType() { return type; }
            @Override public String getValue() { return value; }
            @Override public String toString() { return type + ": " + value; }
        };
    }
}
