package com.wami.security;

import com.wami.arn.TenantPath;
import com.wami.arn.WamiArn;
import com.wami.tenant.TenantId;

/**
 * Enforces that a caller only touches its own tenant or tenants below it.
 * <p>
 * WHY a utility class: every operation on a tenant-scoped resource runs this check before any
 * policy is consulted. Failing fast with {@link TenantAccessDeniedException} keeps a sibling or
 * parent tenant's data out of reach even when a policy would allow the action.
 */
public final class TenantScopeEnforcer {

    private TenantScopeEnforcer() {
        // utility class
    }

    /**
     * @throws TenantAccessDeniedException if the context cannot access {@code target}
     */
    public static void enforce(WamiContext context, TenantPath target) {
        if (!context.canAccessTenant(target)) {
            throw new TenantAccessDeniedException(
                    context.callerArn().toString(), context.tenantPath(), target);
        }
    }

    /**
     * @throws TenantAccessDeniedException if the context cannot access the tenant owning
     *                                     {@code resource}
     */
    public static void enforce(WamiContext context, WamiArn resource) {
        enforce(context, resource.tenantPath());
    }

    /**
     * Checks a hierarchy tenant id. Its segments must be numeric.
     *
     * @throws com.wami.common.InvalidParameterException if {@code tenant} has a non-numeric segment
     * @throws TenantAccessDeniedException               if the context cannot access {@code tenant}
     */
    public static void enforce(WamiContext context, TenantId tenant) {
        enforce(context, tenant.toTenantPath());
    }
}
