package com.wami.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PolicyDocumentValidator")
class PolicyDocumentValidatorTest {

    @Test
    @DisplayName("complete document is valid")
    void valid() {
        var result = PolicyDocumentValidator.validate(
                PolicyDocument.of(PolicyStatement.allow(List.of("iam:GetUser"), List.of("*"))));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("reports every problem at once")
    void collectsAllErrors() {
        var doc = new PolicyDocument(" ", List.of(
                new PolicyStatement(null, null, List.of(), List.of(" "), null)));

        var result = PolicyDocumentValidator.validate(doc);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Version must not be null or blank",
                "Statement[0].Effect must be Allow or Deny",
                "Statement[0].Action must contain at least one entry",
                "Statement[0].Resource must not contain blank entries");
    }

    @Test
    @DisplayName("document without statements is invalid")
    void noStatements() {
        var result = PolicyDocumentValidator.validate(PolicyDocuments.empty());
        assertThat(result.errors()).containsExactly("Statement must contain at least one statement");
    }
}
