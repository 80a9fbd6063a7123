package io.crashreport.sdk.model;

/** Severity of a logged {@link Event} or {@link Breadcrumb}. */
public enum SeverityLevel {
    FATAL("fatal"),
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    DEBUG("debug");

    private final String name;

    SeverityLevel(String name) {
        this.name = name;
    }

    /** Name of the level as it is encoded in the JSON protocol. */
    public String getName() { return name; }
}
