package com.wami.policy;

import java.util.Objects;

/**
 * A policy document labelled with where it came from, so that matches can be traced back.
 *
 * @param policyId policy ARN, inline policy name or input label; {@code null} when anonymous
 * @param document the document
 */
public record SourcedPolicy(String policyId, PolicyDocument document) {

    public SourcedPolicy {
        Objects.requireNonNull(document, "document");
    }

    public static SourcedPolicy anonymous(PolicyDocument document) {
        return new SourcedPolicy(null, document);
    }
}
