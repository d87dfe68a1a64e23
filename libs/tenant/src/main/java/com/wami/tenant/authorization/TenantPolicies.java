package com.wami.tenant.authorization;

import com.wami.policy.PolicyDocument;
import com.wami.policy.PolicyDocuments;
import com.wami.policy.PolicyStatement;
import com.wami.tenant.TenantId;

import java.util.List;

/** Ready-made tenant policies and the resource names they refer to. */
public final class TenantPolicies {

    static final String RESOURCE_PREFIX = "arn:wami:tenant::";

    private TenantPolicies() {
        // utility class
    }

    /** Policy resource name of a tenant: {@code arn:wami:tenant::<tenant-id>}. */
    public static String resourceArn(TenantId id) {
        return RESOURCE_PREFIX + id.value();
    }

    /** Every tenant action on the tenant and all of its descendants. */
    public static String adminPolicy(TenantId id) {
        return PolicyDocuments.toJson(PolicyDocument.of(PolicyStatement.allow(
                List.of(TenantAction.ALL.value()),
                List.of(resourceArn(id), resourceArn(id) + "/*"))));
    }

    /** {@code tenant:Read} on the tenant itself. */
    public static String readOnlyPolicy(TenantId id) {
        return PolicyDocuments.toJson(PolicyDocument.of(PolicyStatement.allow(
                List.of(TenantAction.READ.value()),
                List.of(resourceArn(id)))));
    }
}
