package com.wami.tenant.authorization;

import java.util.Optional;

/** Operations on tenants that policies can grant, as policy action names. */
public enum TenantAction {

    READ("tenant:Read"),
    UPDATE("tenant:Update"),
    DELETE("tenant:Delete"),
    CREATE_SUB_TENANT("tenant:CreateSubTenant"),
    MANAGE_USERS("tenant:ManageUsers"),
    MANAGE_ROLES("tenant:ManageRoles"),
    MANAGE_POLICIES("tenant:ManagePolicies"),
    ALL("tenant:*");

    private final String value;

    TenantAction(String value) {
        this.value = value;
    }

    /** The policy action name (e.g., "tenant:Read"). */
    public String value() {
        return value;
    }

    public static Optional<TenantAction> fromString(String value) {
        for (TenantAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
