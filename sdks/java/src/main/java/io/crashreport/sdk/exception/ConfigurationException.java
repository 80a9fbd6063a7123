package io.crashreport.sdk.exception;

/** Thrown when the client is built from a malformed DSN or incomplete settings. */
public class ConfigurationException extends CrashReportException {
    public ConfigurationException(String message) {
        super(message, 0, "CONFIGURATION_ERROR");
    }
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause, 0, "CONFIGURATION_ERROR");
    }
}
