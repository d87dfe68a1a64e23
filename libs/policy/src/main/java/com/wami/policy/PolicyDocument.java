package com.wami.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An IAM-style policy document: a version tag and an ordered list of statements.
 *
 * <p>Pure value type. Documents are owned by the policy store and handed to the evaluation engine
 * by value; see {@link PolicyDocuments} for the JSON form.
 *
 * @param version   policy language version (normally {@value PolicyDocuments#DEFAULT_VERSION})
 * @param statement statements in document order
 */
public record PolicyDocument(
        @JsonProperty("Version") String version,
        @JsonProperty("Statement") List<PolicyStatement> statement) {

    public PolicyDocument {
        statement = statement == null ? List.of() : List.copyOf(statement);
    }

    /** Creates a document with the default version. */
    public static PolicyDocument of(PolicyStatement... statements) {
        return new PolicyDocument(PolicyDocuments.DEFAULT_VERSION, List.of(statements));
    }
}
