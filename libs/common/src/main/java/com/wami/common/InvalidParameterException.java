package com.wami.common;

/** Thrown when a caller-supplied value is missing, malformed or inconsistent. */
public class InvalidParameterException extends WamiException {

    public InvalidParameterException(String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PARAMETER, message, cause);
    }
}
