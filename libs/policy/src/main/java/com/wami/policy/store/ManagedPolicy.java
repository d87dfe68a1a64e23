package com.wami.policy.store;

import java.util.Objects;

/**
 * A managed policy as held by the policy store.
 *
 * @param policyArn      policy ARN
 * @param policyName     friendly name
 * @param policyDocument raw policy JSON, exactly as stored
 */
public record ManagedPolicy(String policyArn, String policyName, String policyDocument) {

    public ManagedPolicy {
        Objects.requireNonNull(policyArn, "policyArn");
        Objects.requireNonNull(policyDocument, "policyDocument");
    }
}
