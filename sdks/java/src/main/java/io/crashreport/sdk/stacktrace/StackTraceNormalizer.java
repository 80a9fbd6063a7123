package io.crashreport.sdk.stacktrace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts captured stack traces into {@link StackFrame} lists.
 *
 * <p>Accepted inputs are {@code StackTraceElement[]}, a {@link Throwable} (its own stack) and
 * text in the format printed by {@link Throwable#printStackTrace()}.
 *
 * <p>Frames are returned outermost caller first, with the frame that raised the error last.
 * For text input only the first trace block is read; {@code Caused by:} and
 * {@code Suppressed:} sections are ignored, matching what a {@link Throwable} input yields.
 * The normalizer never drops frames itself. If the input cannot be parsed, or the filter
 * throws, the result is an empty list: a broken trace must not prevent an event from being sent.
 */
public final class StackTraceNormalizer {

    private static final Logger log = LoggerFactory.getLogger(StackTraceNormalizer.class);

    //   at com.example.Foo.bar(Foo.java:42)
    //   at java.base/java.lang.Thread.run(Thread.java:833)
    //   at app//com.example.Foo.bar(Unknown Source)
    private static final Pattern FRAME_LINE = Pattern.compile(
            "^\\s*at\\s+(?:[^/()\\s]*/)*([^/()\\s]+)\\.([^./()\\s]+)\\(([^)]*)\\)\\s*$");

    private static final String[] SYSTEM_PREFIXES = {
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "kotlin.", "scala."
    };

    private StackTraceNormalizer() {}

    public static List<StackFrame> normalize(Object stackTrace) {
        return normalize(stackTrace, null);
    }

    /**
     * @param stackTrace a {@code StackTraceElement[]}, {@code Throwable} or {@code String}
     * @param filter     optional filter applied to the full frame list
     * @return frames outermost caller first; never null
     */
    public static List<StackFrame> normalize(Object stackTrace, StackFrameFilter filter) {
        if (stackTrace == null) return List.of();
        try {
            List<StackFrame> frames;
            if (stackTrace instanceof StackTraceElement[]) {
                frames = fromElements((StackTraceElement[]) stackTrace);
            } else if (stackTrace instanceof Throwable) {
                frames = fromElements(((Throwable) stackTrace).getStackTrace());
            } else if (stackTrace instanceof CharSequence) {
                frames = fromText(stackTrace.toString());
            } else {
                throw new IllegalArgumentException("Unsupported stack trace type: " + stackTrace.getClass().getName());
            }
            if (filter != null) {
                List<StackFrame> filtered = filter.filter(new ArrayList<>(frames));
                frames = filtered != null ? filtered : List.of();
            }
            return List.copyOf(frames);
        } catch (RuntimeException e) {
            log.warn("Could not normalize stack trace, sending event without frames", e);
            return List.of();
        }
    }

    /** Normalize and encode into the {@code stacktrace.frames} wire list. */
    public static List<Map<String, Object>> encode(Object stackTrace, StackFrameFilter filter) {
        List<StackFrame> frames = normalize(stackTrace, filter);
        List<Map<String, Object>> encoded = new ArrayList<>(frames.size());
        for (StackFrame frame : frames) {
            encoded.add(frame.toJson());
        }
        return encoded;
    }

    private static List<StackFrame> fromElements(StackTraceElement[] elements) {
        List<StackFrame> frames = new ArrayList<>(elements.length);
        // JVM order is innermost first
        for (int i = elements.length - 1; i >= 0; i--) {
            StackTraceElement e = elements[i];
            frames.add(new StackFrame(
                    e.getFileName(),
                    e.getClassName(),
                    e.getMethodName(),
                    e.getLineNumber() >= 0 ? e.getLineNumber() : -1,
                    -1,
                    null,
                    isInApp(e.getClassName()),
                    e.isNativeMethod()));
        }
        return frames;
    }

    private static List<StackFrame> fromText(String text) {
        List<StackFrame> innermostFirst = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            // only the first trace block; causes and suppressed traces are separate stacks
            if (trimmed.startsWith("Caused by:") || trimmed.startsWith("Suppressed:")) break;
            Matcher m = FRAME_LINE.matcher(line);
            if (!m.matches()) continue;
            String module = m.group(1);
            String function = m.group(2);
            String location = m.group(3);

            String filename = null;
            int lineno = -1;
            boolean nativeMethod = "Native Method".equals(location);
            if (!nativeMethod && !"Unknown Source".equals(location) && !location.isEmpty()) {
                int colon = location.lastIndexOf(':');
                if (colon > 0) {
                    filename = location.substring(0, colon);
                    lineno = parseLine(location.substring(colon + 1));
                } else {
                    filename = location;
                }
            }
            innermostFirst.add(new StackFrame(filename, module, function, lineno, -1, null,
                    isInApp(module), nativeMethod));
        }
        Collections.reverse(innermostFirst);
        return innermostFirst;
    }

    private static int parseLine(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    static boolean isInApp(String module) {
        if (module == null) return false;
        for (String prefix : SYSTEM_PREFIXES) {
            if (module.startsWith(prefix)) return false;
        }
        return true;
    }
}
