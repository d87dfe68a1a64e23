package com.wami.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Effect of a policy statement.
 *
 * <p>WHY case-insensitive lookup: stored policies are written by hand and "allow" and "Allow" are
 * both seen in the wild. Anything else is rejected, which makes the whole document malformed.
 */
public enum Effect {

    ALLOW("Allow"),
    DENY("Deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    /** The canonical policy-language token (e.g., "Allow"). */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Looks up an effect by its token, ignoring case.
     *
     * @return the matching effect, or empty if the token is unknown
     */
    public static Optional<Effect> fromString(String value) {
        for (Effect effect : values()) {
            if (effect.value.equalsIgnoreCase(value)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Effect fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown policy effect: " + value));
    }
}
