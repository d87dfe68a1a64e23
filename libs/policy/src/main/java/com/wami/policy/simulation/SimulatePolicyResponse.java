package com.wami.policy.simulation;

import com.wami.policy.EvaluationResult;

import java.util.List;

/**
 * One result per (action, resource) pair, actions outermost.
 *
 * @param evaluationResults results in request order
 * @param truncated         always {@code false}; results are not paged
 */
public record SimulatePolicyResponse(List<EvaluationResult> evaluationResults, boolean truncated) {

    public SimulatePolicyResponse {
        evaluationResults = List.copyOf(evaluationResults);
    }
}
