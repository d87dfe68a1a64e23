package com.wami.tenant;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the tenant hierarchy.
 *
 * <p>Immutable; the {@code with*} methods return modified copies. New tenants come from
 * {@link TenantRules#newTenant(TenantId, String, TenantId)}.
 *
 * @param id                  hierarchical id
 * @param parentId            enclosing tenant, or {@code null} for a root tenant
 * @param name                display name, unique within the parent
 * @param organization        organization name, or {@code null}
 * @param tenantType          classification
 * @param status              lifecycle state
 * @param quotas              the tenant's own quotas (see {@link #quotaMode})
 * @param quotaMode           whether {@link #quotas} apply or are inherited
 * @param maxChildDepth       how many levels of sub-tenants may exist below this tenant
 * @param canCreateSubTenants whether sub-tenants may be created at all
 * @param adminPrincipals     ARNs of the principals administering this tenant
 * @param providerAccounts    provider name to account id
 * @param metadata            free-form labels
 * @param createdAt           creation time
 */
public record Tenant(
        TenantId id,
        TenantId parentId,
        String name,
        String organization,
        TenantType tenantType,
        TenantStatus status,
        TenantQuotas quotas,
        QuotaMode quotaMode,
        int maxChildDepth,
        boolean canCreateSubTenants,
        List<String> adminPrincipals,
        Map<String, String> providerAccounts,
        Map<String, String> metadata,
        Instant createdAt) {

    public Tenant {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tenantType, "tenantType");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(quotas, "quotas");
        Objects.requireNonNull(quotaMode, "quotaMode");
        Objects.requireNonNull(createdAt, "createdAt");
        adminPrincipals = adminPrincipals == null ? List.of() : List.copyOf(adminPrincipals);
        providerAccounts = providerAccounts == null ? Map.of() : Map.copyOf(providerAccounts);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Optional<TenantId> parentIdOptional() {
        return Optional.ofNullable(parentId);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isAdmin(String principalArn) {
        return adminPrincipals.contains(principalArn);
    }

    public Tenant withStatus(TenantStatus newStatus) {
        return new Tenant(id, parentId, name, organization, tenantType, newStatus, quotas, quotaMode,
                maxChildDepth, canCreateSubTenants, adminPrincipals, providerAccounts, metadata, createdAt);
    }

    /** Copy with its own quotas in effect ({@link QuotaMode#OVERRIDE}). */
    public Tenant withQuotas(TenantQuotas newQuotas) {
        return new Tenant(id, parentId, name, organization, tenantType, status, newQuotas, QuotaMode.OVERRIDE,
                maxChildDepth, canCreateSubTenants, adminPrincipals, providerAccounts, metadata, createdAt);
    }

    public Tenant withQuotaMode(QuotaMode newMode) {
        return new Tenant(id, parentId, name, organization, tenantType, status, quotas, newMode,
                maxChildDepth, canCreateSubTenants, adminPrincipals, providerAccounts, metadata, createdAt);
    }

    public Tenant withAdminPrincipals(List<String> principals) {
        return new Tenant(id, parentId, name, organization, tenantType, status, quotas, quotaMode,
                maxChildDepth, canCreateSubTenants, principals, providerAccounts, metadata, createdAt);
    }

    public Tenant withSubTenantCreation(boolean allowed) {
        return new Tenant(id, parentId, name, organization, tenantType, status, quotas, quotaMode,
                maxChildDepth, allowed, adminPrincipals, providerAccounts, metadata, createdAt);
    }
}
