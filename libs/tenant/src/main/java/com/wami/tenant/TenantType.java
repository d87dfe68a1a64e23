package com.wami.tenant;

/** Classification of a tenant within the hierarchy. */
public enum TenantType {
    ROOT,
    ENTERPRISE,
    DEPARTMENT,
    TEAM,
    PROJECT
}
