package com.wami.common;

/**
 * Base class of every failure raised by the WAMI core.
 *
 * <p>WHY a RuntimeException: parsing, building and authorization either produce a valid value or
 * fail fast. There is no partially valid result for a caller to recover.
 */
public abstract class WamiException extends RuntimeException {

    private final ErrorKind kind;

    protected WamiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WamiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** The category of this failure. */
    public ErrorKind kind() {
        return kind;
    }
}
