package com.wami.tenant;

/** Lifecycle state of a tenant. Only {@link #ACTIVE} tenants may create sub-tenants. */
public enum TenantStatus {

    /** Operational. */
    ACTIVE,

    /** Read-only. */
    SUSPENDED,

    /** Awaiting activation. */
    PENDING,

    /** Marked for deletion. */
    DELETED
}
