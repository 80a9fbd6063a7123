package io.crashreport.sdk.exception;

/**
 * Base exception for all CrashReport SDK errors.
 */
public class CrashReportException extends RuntimeException {
    private final int status;
    private final String code;

    public CrashReportException(String message, int status, String code) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public CrashReportException(String message, Throwable cause, int status, String code) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    /** HTTP status associated with the error, or 0 when no response was received. */
    public int getStatus() { return status; }
    public String getCode() { return code; }
}
