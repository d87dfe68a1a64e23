package com.wami.policy.store;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the policy data the authorization path needs.
 *
 * <p>Implemented by the storage layer. Implementations must be safe for concurrent readers and
 * return a consistent snapshot of each document. Any {@link RuntimeException} thrown here
 * propagates out of the authorization check unchanged.
 */
public interface PolicyStore {

    /** ARNs of the managed policies attached to a user, in attachment order. */
    List<String> listAttachedUserPolicies(String userId);

    /** A managed policy by ARN. */
    Optional<ManagedPolicy> getPolicy(String policyArn);

    /** Names of a user's inline policies. */
    List<String> listUserPolicies(String userId);

    /** Raw JSON of one of a user's inline policies. */
    Optional<String> getUserPolicy(String userId, String policyName);
}
