package com.wami.policy.simulation;

import com.wami.arn.WamiArn;
import com.wami.policy.ContextEntry;
import com.wami.policy.EvaluationResult;
import com.wami.policy.PolicyDocuments;
import com.wami.policy.PolicyEvaluationEngine;
import com.wami.policy.SourcedPolicy;
import com.wami.policy.store.PolicyStore;
import com.wami.policy.store.Principals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dry-run policy evaluation: what would these policies decide for these actions and resources?
 *
 * <p>Every (action, resource) pair is evaluated independently with the combined policy set, so a
 * Deny anywhere in the set wins. A single malformed document, supplied or stored, fails the whole
 * simulation.
 */
public class PolicySimulator {

    private static final Logger log = LoggerFactory.getLogger(PolicySimulator.class);

    static final List<String> ALL_RESOURCES = List.of("*");
    static final String INPUT_LABEL = "input-";

    private final PolicyStore policyStore;

    public PolicySimulator(PolicyStore policyStore) {
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
    }

    /**
     * Simulates caller-supplied policy documents.
     *
     * @throws com.wami.common.InvalidParameterException if any document is malformed
     */
    public SimulatePolicyResponse simulateCustomPolicy(SimulateCustomPolicyRequest request) {
        List<SourcedPolicy> policies = parseInputs(request.policyInputList());
        return simulate(policies, request.actionNames(), request.resourceArns(), request.contextEntries());
    }

    /**
     * Simulates a user's attached and inline policies, followed by any extra input documents.
     *
     * @throws com.wami.common.InvalidParameterException if the source is not a user ARN or any
     *     document is malformed
     * @throws com.wami.arn.ArnParseException if the source ARN does not parse
     */
    public SimulatePolicyResponse simulatePrincipalPolicy(SimulatePrincipalPolicyRequest request) {
        String userId = Principals.userId(WamiArn.parse(request.policySourceArn()));

        List<SourcedPolicy> policies = new ArrayList<>();
        for (String policyArn : policyStore.listAttachedUserPolicies(userId)) {
            policyStore.getPolicy(policyArn).ifPresent(policy -> policies.add(
                    new SourcedPolicy(policy.policyArn(), PolicyDocuments.parse(policy.policyDocument()))));
        }
        for (String policyName : policyStore.listUserPolicies(userId)) {
            policyStore.getUserPolicy(userId, policyName).ifPresent(json -> policies.add(
                    new SourcedPolicy(policyName, PolicyDocuments.parse(json))));
        }
        policies.addAll(parseInputs(request.policyInputList()));

        log.debug("Simulating {} policies for user {}", policies.size(), userId);
        return simulate(policies, request.actionNames(), request.resourceArns(), request.contextEntries());
    }

    private static List<SourcedPolicy> parseInputs(List<String> inputs) {
        List<SourcedPolicy> policies = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            policies.add(new SourcedPolicy(INPUT_LABEL + (i + 1), PolicyDocuments.parse(inputs.get(i))));
        }
        return policies;
    }

    private static SimulatePolicyResponse simulate(
            List<SourcedPolicy> policies,
            List<String> actions,
            List<String> resourceArns,
            List<ContextEntry> contextEntries) {
        List<String> resources = resourceArns != null ? resourceArns : ALL_RESOURCES;

        List<EvaluationResult> results = new ArrayList<>(actions.size() * resources.size());
        for (String action : actions) {
            for (String resource : resources) {
                results.add(PolicyEvaluationEngine.evaluateWithDetails(policies, action, resource, contextEntries));
            }
        }

        log.debug("Simulated {} actions x {} resources against {} policies: {} allowed",
                actions.size(), resources.size(), policies.size(),
                results.stream().filter(EvaluationResult::isAllowed).count());
        return new SimulatePolicyResponse(results, false);
    }
}
