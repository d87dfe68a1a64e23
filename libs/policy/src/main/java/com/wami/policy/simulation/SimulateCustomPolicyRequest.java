package com.wami.policy.simulation;

import com.wami.policy.ContextEntry;

import java.util.List;

/**
 * Simulates caller-supplied policies.
 *
 * @param policyInputList raw policy JSON documents
 * @param actionNames     actions to evaluate
 * @param resourceArns    resources to evaluate; {@code null} means {@code ["*"]}
 * @param contextEntries  request context, or {@code null}
 */
public record SimulateCustomPolicyRequest(
        List<String> policyInputList,
        List<String> actionNames,
        List<String> resourceArns,
        List<ContextEntry> contextEntries) {

    public SimulateCustomPolicyRequest {
        policyInputList = policyInputList == null ? List.of() : List.copyOf(policyInputList);
        actionNames = actionNames == null ? List.of() : List.copyOf(actionNames);
        resourceArns = resourceArns == null ? null : List.copyOf(resourceArns);
        contextEntries = contextEntries == null ? List.of() : List.copyOf(contextEntries);
    }
}
