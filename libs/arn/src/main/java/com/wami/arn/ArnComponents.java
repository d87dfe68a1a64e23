package com.wami.arn;

import com.wami.common.InvalidParameterException;

/**
 * Field checks shared by the ARN value types, so that every {@link WamiArn} has a canonical form
 * that parses back to an equal value.
 */
final class ArnComponents {

    private ArnComponents() {
        // utility class
    }

    /** Rejects an empty value. */
    static String requireNonEmpty(String value, String field) {
        if (value.isEmpty()) {
            throw new InvalidParameterException(field + " cannot be empty");
        }
        return value;
    }

    /** Rejects an empty value or one containing any of {@code forbidden}. */
    static String requireToken(String value, String field, char... forbidden) {
        requireNonEmpty(value, field);
        for (char c : forbidden) {
            if (value.indexOf(c) >= 0) {
                throw new InvalidParameterException("%s cannot contain '%s'".formatted(field, c));
            }
        }
        return value;
    }
}
