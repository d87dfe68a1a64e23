package com.wami.policy;

/** Outcome of evaluating one or more policy documents against an action and a resource. */
public enum PolicyDecision {

    /** A matching Allow statement and no matching Deny. */
    ALLOW,

    /** At least one matching Deny statement. Overrides any Allow. */
    DENY,

    /** Nothing matched. Callers treat this as an implicit deny. */
    NO_MATCH;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
