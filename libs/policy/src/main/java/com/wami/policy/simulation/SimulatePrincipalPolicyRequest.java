package com.wami.policy.simulation;

import com.wami.policy.ContextEntry;

import java.util.List;
import java.util.Objects;

/**
 * Simulates the policies stored for a principal, plus optional extra documents.
 *
 * @param policySourceArn ARN of the user whose policies are simulated
 * @param actionNames     actions to evaluate
 * @param resourceArns    resources to evaluate; {@code null} means {@code ["*"]}
 * @param policyInputList additional raw policy JSON documents, or {@code null}
 * @param contextEntries  request context, or {@code null}
 */
public record SimulatePrincipalPolicyRequest(
        String policySourceArn,
        List<String> actionNames,
        List<String> resourceArns,
        List<String> policyInputList,
        List<ContextEntry> contextEntries) {

    public SimulatePrincipalPolicyRequest {
        Objects.requireNonNull(policySourceArn, "policySourceArn");
        actionNames = actionNames == null ? List.of() : List.copyOf(actionNames);
        resourceArns = resourceArns == null ? null : List.copyOf(resourceArns);
        policyInputList = policyInputList == null ? List.of() : List.copyOf(policyInputList);
        contextEntries = contextEntries == null ? List.of() : List.copyOf(contextEntries);
    }
}
