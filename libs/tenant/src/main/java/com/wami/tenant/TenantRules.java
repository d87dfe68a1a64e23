package com.wami.tenant;

import com.wami.common.InvalidParameterException;
import com.wami.common.ValidationResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pure rules for creating tenants and growing the hierarchy.
 * <p>
 * WHY a utility class: none of these checks needs a store. Callers that do have one combine them
 * with lookups (see {@link TenantHierarchyService}).
 */
public final class TenantRules {

    public static final int MAX_NAME_LENGTH = 64;
    public static final int DEFAULT_MAX_CHILD_DEPTH = 3;

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private TenantRules() {
        // utility class
    }

    /**
     * A new active enterprise tenant with default quotas, inherited quota mode, a child depth of
     * {@value #DEFAULT_MAX_CHILD_DEPTH} and sub-tenant creation enabled.
     *
     * @param parentId enclosing tenant, or {@code null} for a root tenant
     */
    public static Tenant newTenant(TenantId id, String name, TenantId parentId) {
        return newTenant(id, name, parentId, Instant.now());
    }

    public static Tenant newTenant(TenantId id, String name, TenantId parentId, Instant createdAt) {
        return new Tenant(
                id,
                parentId,
                name,
                null,
                TenantType.ENTERPRISE,
                TenantStatus.ACTIVE,
                TenantQuotas.defaults(),
                QuotaMode.INHERITED,
                DEFAULT_MAX_CHILD_DEPTH,
                true,
                List.of(),
                Map.of(),
                Map.of(),
                createdAt);
    }

    /**
     * Checks a tenant name: 1 to {@value #MAX_NAME_LENGTH} characters of letters, digits,
     * {@code -} and {@code _}.
     *
     * @throws InvalidParameterException if the name is not acceptable
     */
    public static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidParameterException("Tenant name cannot be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidParameterException(
                    "Tenant name cannot exceed %d characters".formatted(MAX_NAME_LENGTH));
        }
        if (!NAME.matcher(name).matches()) {
            throw new InvalidParameterException(
                    "Tenant name can only contain alphanumeric characters, hyphens, and underscores");
        }
    }

    public static boolean isValidDepth(TenantId id, int maxDepth) {
        return id.depth() <= maxDepth;
    }

    public static boolean canCreateChild(Tenant tenant) {
        return tenant.canCreateSubTenants() && tenant.status() == TenantStatus.ACTIVE;
    }

    /** Checks that an overriding child does not grant more than its parent. */
    public static ValidationResult validateChildQuotas(TenantQuotas child, TenantQuotas parent) {
        return child.validateAgainstParent(parent);
    }
}
