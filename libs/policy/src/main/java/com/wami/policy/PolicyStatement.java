package com.wami.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One Allow or Deny rule of a policy document.
 *
 * <p>{@code Action} and {@code Resource} accept a single string or an array on input and are
 * always written as arrays. {@code Condition} is carried through untouched; it takes no part in
 * evaluation.
 *
 * @param sid       optional statement id
 * @param effect    Allow or Deny
 * @param action    action patterns (e.g., "iam:Get*")
 * @param resource  resource patterns (e.g., "arn:wami:iam:12345678/*")
 * @param condition raw condition block, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyStatement(
        @JsonProperty("Sid") String sid,
        @JsonProperty("Effect") Effect effect,
        @JsonProperty("Action") List<String> action,
        @JsonProperty("Resource") List<String> resource,
        @JsonProperty("Condition") JsonNode condition) {

    public PolicyStatement {
        action = action == null ? List.of() : List.copyOf(action);
        resource = resource == null ? List.of() : List.copyOf(resource);
    }

    /** Creates an Allow statement without sid or condition. */
    public static PolicyStatement allow(List<String> action, List<String> resource) {
        return new PolicyStatement(null, Effect.ALLOW, action, resource, null);
    }

    /** Creates a Deny statement without sid or condition. */
    public static PolicyStatement deny(List<String> action, List<String> resource) {
        return new PolicyStatement(null, Effect.DENY, action, resource, null);
    }
}
