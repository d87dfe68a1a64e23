package com.wami.arn;

import com.wami.common.ErrorKind;
import com.wami.common.WamiException;

/**
 * Thrown when a string is not a valid canonical WAMI ARN.
 *
 * <p>The message is prefixed by the failure category so that it reads well on its own, e.g.
 * {@code "Invalid ARN format: Expected at least 7 parts, got 3"}.
 */
public class ArnParseException extends WamiException {

    /** What went wrong while parsing. */
    public enum Kind {
        INVALID_FORMAT(ErrorKind.INVALID_FORMAT, "Invalid ARN format"),
        MISSING_COMPONENT(ErrorKind.MISSING_COMPONENT, "Missing ARN component"),
        INVALID_COMPONENT(ErrorKind.INVALID_COMPONENT, "Invalid ARN component");

        private final ErrorKind errorKind;
        private final String label;

        Kind(ErrorKind errorKind, String label) {
            this.errorKind = errorKind;
            this.label = label;
        }

        public ErrorKind errorKind() {
            return errorKind;
        }
    }

    private final Kind parseKind;
    private final String detail;

    public ArnParseException(Kind parseKind, String detail) {
        super(parseKind.errorKind(), parseKind.label + ": " + detail);
        this.parseKind = parseKind;
        this.detail = detail;
    }

    public Kind parseKind() {
        return parseKind;
    }

    /** The message without the category prefix. */
    public String detail() {
        return detail;
    }
}
