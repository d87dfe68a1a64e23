package com.wami.tenant;

import com.wami.common.InvalidParameterException;
import com.wami.common.ValidationResult;

import java.util.ArrayList;

/**
 * Resource limits of a tenant.
 *
 * @param maxUsers      maximum IAM users
 * @param maxRoles      maximum roles
 * @param maxPolicies   maximum managed policies
 * @param maxGroups     maximum groups
 * @param maxAccessKeys maximum access keys
 * @param maxSubTenants maximum direct sub-tenants
 * @param apiRateLimit  API requests per minute
 */
public record TenantQuotas(
        int maxUsers,
        int maxRoles,
        int maxPolicies,
        int maxGroups,
        int maxAccessKeys,
        int maxSubTenants,
        int apiRateLimit) {

    private static final TenantQuotas DEFAULTS = new TenantQuotas(1000, 500, 100, 100, 2000, 10, 1000);

    public TenantQuotas {
        if (maxUsers < 0 || maxRoles < 0 || maxPolicies < 0 || maxGroups < 0
                || maxAccessKeys < 0 || maxSubTenants < 0 || apiRateLimit < 0) {
            throw new InvalidParameterException("Tenant quotas must not be negative");
        }
    }

    /** 1000 users, 500 roles, 100 policies, 100 groups, 2000 access keys, 10 sub-tenants, 1000 req/min. */
    public static TenantQuotas defaults() {
        return DEFAULTS;
    }

    /** Checks that no limit exceeds the corresponding limit of {@code parent}. */
    public ValidationResult validateAgainstParent(TenantQuotas parent) {
        var errors = new ArrayList<String>();
        check(errors, "maxUsers", maxUsers, parent.maxUsers);
        check(errors, "maxRoles", maxRoles, parent.maxRoles);
        check(errors, "maxPolicies", maxPolicies, parent.maxPolicies);
        check(errors, "maxGroups", maxGroups, parent.maxGroups);
        check(errors, "maxAccessKeys", maxAccessKeys, parent.maxAccessKeys);
        check(errors, "maxSubTenants", maxSubTenants, parent.maxSubTenants);
        return ValidationResult.of(errors);
    }

    private static void check(ArrayList<String> errors, String field, int child, int parent) {
        if (child > parent) {
            errors.add("%s (%d) exceeds parent limit (%d)".formatted(field, child, parent));
        }
    }
}
