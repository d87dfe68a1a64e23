package com.wami.security.config;

/** What an authorization check does with a stored policy whose JSON cannot be parsed. */
public enum MalformedPolicyHandling {

    /** Treat the policy as a document with no statements and log a warning. */
    EMPTY_DOCUMENT,

    /** Fail the whole check with an {@link com.wami.common.InvalidParameterException}. */
    FAIL_CLOSED
}
