package com.wami.security;

import com.wami.arn.TenantPath;
import com.wami.common.AccessDeniedException;

/**
 * Thrown when a caller reaches outside its tenant scope.
 * <p>
 * WHY a subclass of {@link AccessDeniedException}: callers that map access refusals to a
 * response code handle both the same way, while tenant-aware callers can read the two paths.
 */
public class TenantAccessDeniedException extends AccessDeniedException {

    private final TenantPath callerTenant;
    private final TenantPath targetTenant;

    public TenantAccessDeniedException(String principal, TenantPath callerTenant, TenantPath targetTenant) {
        super("Tenant scope violation: caller in tenant '%s' cannot access tenant '%s'"
                        .formatted(callerTenant, targetTenant),
                principal, "tenant:Access", targetTenant.toString());
        this.callerTenant = callerTenant;
        this.targetTenant = targetTenant;
    }

    public TenantPath callerTenant() {
        return callerTenant;
    }

    public TenantPath targetTenant() {
        return targetTenant;
    }
}
