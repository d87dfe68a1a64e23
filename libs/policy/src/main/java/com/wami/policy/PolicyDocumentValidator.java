package com.wami.policy;

import com.wami.common.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a {@link PolicyDocument} is complete enough to be stored.
 * <p>
 * WHY manual validation: no annotation processing dependency, and every problem is reported at
 * once instead of one per round trip.
 */
public final class PolicyDocumentValidator {

    private PolicyDocumentValidator() {
        // utility class
    }

    public static ValidationResult validate(PolicyDocument document) {
        var errors = new ArrayList<String>();

        if (isBlank(document.version())) {
            errors.add("Version must not be null or blank");
        }
        if (document.statement().isEmpty()) {
            errors.add("Statement must contain at least one statement");
        }

        List<PolicyStatement> statements = document.statement();
        for (int i = 0; i < statements.size(); i++) {
            PolicyStatement statement = statements.get(i);
            if (statement.effect() == null) {
                errors.add("Statement[%d].Effect must be Allow or Deny".formatted(i));
            }
            checkPatterns(errors, i, "Action", statement.action());
            checkPatterns(errors, i, "Resource", statement.resource());
        }

        return ValidationResult.of(errors);
    }

    private static void checkPatterns(List<String> errors, int index, String field, List<String> patterns) {
        if (patterns.isEmpty()) {
            errors.add("Statement[%d].%s must contain at least one entry".formatted(index, field));
            return;
        }
        for (String pattern : patterns) {
            if (isBlank(pattern)) {
                errors.add("Statement[%d].%s must not contain blank entries".formatted(index, field));
                return;
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
