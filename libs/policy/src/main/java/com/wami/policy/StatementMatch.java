package com.wami.policy;

/**
 * A statement that applied to an evaluated action and resource.
 *
 * @param sourcePolicyId   policy the statement came from (ARN, inline policy name or input
 *                         label), or {@code null} when unknown
 * @param effect           the statement's effect
 * @param matchedAction    the action pattern that matched
 * @param matchedResource  the resource pattern that matched
 */
public record StatementMatch(String sourcePolicyId, Effect effect, String matchedAction, String matchedResource) {
}
