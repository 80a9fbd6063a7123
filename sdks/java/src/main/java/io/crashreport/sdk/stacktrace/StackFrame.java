package io.crashreport.sdk.stacktrace;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One frame of a normalized stack trace.
 *
 * <p>Frames are immutable; a {@link StackFrameFilter} that wants to change one creates a copy
 * through the {@code with*} methods.
 */
public final class StackFrame {
    private final String filename;
    private final String module;
    private final String function;
    private final int lineno;
    private final int colno;
    private final String absPath;
    private final boolean inApp;
    private final boolean nativeMethod;

    public StackFrame(String filename, String module, String function, int lineno, int colno,
                      String absPath, boolean inApp, boolean nativeMethod) {
        this.filename = filename;
        this.module = module;
        this.function = function;
        this.lineno = lineno;
        this.colno = colno;
        this.absPath = absPath;
        this.inApp = inApp;
        this.nativeMethod = nativeMethod;
    }

    public String getFilename() { return filename; }
    /** Fully qualified class name. */
    public String getModule() { return module; }
    public String getFunction() { return function; }
    /** Line number, or -1 when unknown. */
    public int getLineno() { return lineno; }
    /** Column number, or -1 when unknown. JVM traces never carry one. */
    public int getColno() { return colno; }
    public String getAbsPath() { return absPath; }
    public boolean isInApp() { return inApp; }
    public boolean isNative() { return nativeMethod; }

    public StackFrame withInApp(boolean inApp) {
        return new StackFrame(filename, module, function, lineno, colno, absPath, inApp, nativeMethod);
    }

    public StackFrame withAbsPath(String absPath) {
        return new StackFrame(filename, module, function, lineno, colno, absPath, inApp, nativeMethod);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        if (absPath != null) json.put("abs_path", absPath);
        if (filename != null) json.put("filename", filename);
        if (module != null) json.put("module", module);
        if (function != null) json.put("function", function);
        if (lineno >= 0) json.put("lineno", lineno);
        if (colno >= 0) json.put("colno", colno);
        json.put("in_app", inApp);
        if (nativeMethod) json.put("native", true);
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StackFrame)) return false;
        StackFrame that = (StackFrame) o;
        return lineno == that.lineno && colno == that.colno && inApp == that.inApp
                && nativeMethod == that.nativeMethod
                && Objects.equals(filename, that.filename) && Objects.equals(module, that.module)
                && Objects.equals(function, that.function) && Objects.equals(absPath, that.absPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, module, function, lineno, colno, absPath, inApp, nativeMethod);
    }

    @Override
    public String toString() {
        return module + "." + function + "(" + filename + ":" + lineno + ")";
    }
}
