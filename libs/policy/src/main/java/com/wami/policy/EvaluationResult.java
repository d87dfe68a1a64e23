package com.wami.policy;

import java.util.List;

/**
 * Detailed result of evaluating one action against one resource.
 *
 * @param evalActionName       the evaluated action
 * @param evalResourceName     the evaluated resource
 * @param decision             aggregate decision; {@link PolicyDecision#NO_MATCH} is an implicit deny
 * @param matchedStatements    every statement that matched, in evaluation order
 * @param missingContextValues context keys that conditions needed but the request lacked (always
 *                             empty, conditions are not evaluated)
 */
public record EvaluationResult(
        String evalActionName,
        String evalResourceName,
        PolicyDecision decision,
        List<StatementMatch> matchedStatements,
        List<String> missingContextValues) {

    public static final String ALLOWED = "allowed";
    public static final String DENIED = "denied";

    public EvaluationResult {
        matchedStatements = List.copyOf(matchedStatements);
        missingContextValues = List.copyOf(missingContextValues);
    }

    /** {@value #ALLOWED} or {@value #DENIED}. */
    public String evalDecision() {
        return decision.isAllowed() ? ALLOWED : DENIED;
    }

    public boolean isAllowed() {
        return decision.isAllowed();
    }
}
