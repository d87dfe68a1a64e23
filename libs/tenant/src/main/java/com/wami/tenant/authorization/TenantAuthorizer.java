package com.wami.tenant.authorization;

import com.wami.policy.PolicyDocument;
import com.wami.policy.PolicyDocuments;
import com.wami.policy.PolicyEvaluationEngine;
import com.wami.tenant.TenantId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides tenant operations with ordinary policy documents.
 *
 * <p>The resource is {@code arn:wami:tenant::<tenant-id>} (see {@link TenantPolicies}). All
 * documents are evaluated as one set, so an explicit Deny anywhere wins over any Allow. The
 * principal is carried for logging only: the policies given are the principal's policies.
 */
public class TenantAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(TenantAuthorizer.class);

    private final List<PolicyDocument> policies;

    private TenantAuthorizer(List<PolicyDocument> policies) {
        this.policies = List.copyOf(policies);
    }

    /** Builds an authorizer from raw policy JSON. Unparseable documents are dropped with a warning. */
    public static TenantAuthorizer fromJson(List<String> policyJsonList) {
        List<PolicyDocument> documents = new ArrayList<>(policyJsonList.size());
        for (int i = 0; i < policyJsonList.size(); i++) {
            Optional<PolicyDocument> document = PolicyDocuments.tryParse(policyJsonList.get(i));
            if (document.isPresent()) {
                documents.add(document.get());
            } else {
                log.warn("Dropping unparseable tenant policy at index {}", i);
            }
        }
        return new TenantAuthorizer(documents);
    }

    public static TenantAuthorizer fromDocuments(List<PolicyDocument> documents) {
        return new TenantAuthorizer(documents);
    }

    /** True when the policies allow {@code action} on {@code tenantId} and nothing denies it. */
    public boolean checkPermission(String principalArn, TenantId tenantId, TenantAction action) {
        boolean allowed = PolicyEvaluationEngine
                .evaluate(policies, action.value(), TenantPolicies.resourceArn(tenantId))
                .isAllowed();
        log.debug("Tenant action {} on {} for {}: {}", action.value(), tenantId, principalArn,
                allowed ? "allowed" : "denied");
        return allowed;
    }

    /** Number of usable documents. */
    public int policyCount() {
        return policies.size();
    }
}
