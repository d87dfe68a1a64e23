package com.wami.common;

/**
 * Categories of failure raised by the WAMI core.
 *
 * <p>WHY an enum: callers that map errors onto an outer surface (HTTP status, CLI exit code) switch
 * on the kind instead of on exception classes.
 */
public enum ErrorKind {

    /** Structurally malformed ARN or provider identifier (wrong prefix, marker or segment count). */
    INVALID_FORMAT("InvalidFormat"),

    /** A required component is absent. */
    MISSING_COMPONENT("MissingComponent"),

    /** A component is present but fails domain validation. */
    INVALID_COMPONENT("InvalidComponent"),

    /** A caller-supplied value was rejected. */
    INVALID_PARAMETER("InvalidParameter"),

    /** A referenced tenant, parent or policy does not exist in the collaborator store. */
    RESOURCE_NOT_FOUND("ResourceNotFound"),

    /** Authorization explicitly refused. */
    ACCESS_DENIED("AccessDenied");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "AccessDenied"). */
    public String value() {
        return value;
    }
}
