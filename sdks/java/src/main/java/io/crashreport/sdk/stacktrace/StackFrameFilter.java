package io.crashreport.sdk.stacktrace;

import java.util.List;

/**
 * Receives the complete frame list, outermost caller first, just before it is encoded.
 * The list is a fresh mutable copy, so it may be edited in place and returned. May drop,
 * reorder or replace frames; whatever it returns is sent as is.
 */
@FunctionalInterface
public interface StackFrameFilter {
    List<StackFrame> filter(List<StackFrame> frames);
}
