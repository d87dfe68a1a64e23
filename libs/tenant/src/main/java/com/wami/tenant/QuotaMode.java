package com.wami.tenant;

/** Where a tenant's effective quotas come from. */
public enum QuotaMode {

    /** Use the nearest ancestor's quotas ({@code OVERRIDE} ancestor or the root). */
    INHERITED,

    /** Use the tenant's own quotas. */
    OVERRIDE
}
