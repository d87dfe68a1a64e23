package com.wami.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure evaluation of policy documents against an action and a resource.
 *
 * <p>Rules, applied to every statement whose action patterns and resource patterns both match:
 * <ul>
 *   <li>any matching Deny gives {@link PolicyDecision#DENY}, whatever else matched</li>
 *   <li>otherwise any matching Allow gives {@link PolicyDecision#ALLOW}</li>
 *   <li>otherwise {@link PolicyDecision#NO_MATCH}</li>
 * </ul>
 * The rules hold across documents as well as within one: a Deny in any document of the set wins.
 */
public final class PolicyEvaluationEngine {

    private PolicyEvaluationEngine() {
        // utility class
    }

    /** True when one of the statement's action patterns and one of its resource patterns match. */
    public static boolean statementMatches(PolicyStatement statement, String action, String resource) {
        return WildcardMatcher.matchesAny(statement.action(), action)
                && WildcardMatcher.matchesAny(statement.resource(), resource);
    }

    /** Evaluates a single document. */
    public static PolicyDecision evaluateDocument(PolicyDocument document, String action, String resource) {
        return evaluate(List.of(document), action, resource);
    }

    /** Evaluates a set of documents as one combined policy. */
    public static PolicyDecision evaluate(List<PolicyDocument> documents, String action, String resource) {
        boolean allowed = false;
        for (PolicyDocument document : documents) {
            for (PolicyStatement statement : document.statement()) {
                if (statement.effect() == null || !statementMatches(statement, action, resource)) {
                    continue;
                }
                if (statement.effect() == Effect.DENY) {
                    return PolicyDecision.DENY;
                }
                allowed = true;
            }
        }
        return allowed ? PolicyDecision.ALLOW : PolicyDecision.NO_MATCH;
    }

    /**
     * Evaluates a set of documents and records every matching statement.
     *
     * @param contextEntries request context; accepted for completeness, conditions are not
     *                       evaluated
     */
    public static EvaluationResult evaluateWithDetails(
            List<SourcedPolicy> policies,
            String action,
            String resource,
            List<ContextEntry> contextEntries) {
        boolean allowed = false;
        boolean denied = false;
        List<StatementMatch> matches = new ArrayList<>();

        for (SourcedPolicy policy : policies) {
            for (PolicyStatement statement : policy.document().statement()) {
                if (statement.effect() == null) {
                    continue;
                }
                String matchedAction = WildcardMatcher.firstMatch(statement.action(), action);
                if (matchedAction == null) {
                    continue;
                }
                String matchedResource = WildcardMatcher.firstMatch(statement.resource(), resource);
                if (matchedResource == null) {
                    continue;
                }
                matches.add(new StatementMatch(policy.policyId(), statement.effect(), matchedAction, matchedResource));
                if (statement.effect() == Effect.DENY) {
                    denied = true;
                } else {
                    allowed = true;
                }
            }
        }

        PolicyDecision decision = denied ? PolicyDecision.DENY
                : allowed ? PolicyDecision.ALLOW
                : PolicyDecision.NO_MATCH;
        return new EvaluationResult(action, resource, decision, matches, List.of());
    }
}
