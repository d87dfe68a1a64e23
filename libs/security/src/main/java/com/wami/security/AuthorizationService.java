package com.wami.security;

import com.wami.arn.WamiArn;
import com.wami.common.AccessDeniedException;
import com.wami.common.InvalidParameterException;
import com.wami.policy.PolicyDecision;
import com.wami.policy.PolicyDocument;
import com.wami.policy.PolicyDocuments;
import com.wami.policy.PolicyEvaluationEngine;
import com.wami.policy.store.ManagedPolicy;
import com.wami.policy.store.PolicyStore;
import com.wami.policy.store.Principals;
import com.wami.security.AuthorizationMetrics.Outcome;
import com.wami.security.config.AuthorizationProperties;
import com.wami.security.config.MalformedPolicyHandling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether the caller of a {@link WamiContext} may perform an action on a resource.
 * <p>
 * Root callers are allowed without any lookup. For everyone else the caller's managed policies
 * are read from the {@link PolicyStore} in attachment order, then the inline policies, and each
 * document is evaluated in turn. The first document that denies ends the check with a refusal and
 * the first that allows ends it with a grant; when no document matches the request is implicitly
 * denied.
 * <p>
 * WHY no fallback on store errors: any exception from the store propagates, so a check never
 * succeeds because policies could not be read. The service keeps no mutable state and is safe for
 * concurrent use.
 */
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final PolicyStore policyStore;
    private final AuthorizationProperties properties;
    private final AuthorizationMetrics metrics;

    public AuthorizationService(PolicyStore policyStore) {
        this(policyStore, AuthorizationProperties.defaults(), AuthorizationMetrics.standalone());
    }

    public AuthorizationService(
            PolicyStore policyStore, AuthorizationProperties properties, AuthorizationMetrics metrics) {
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Evaluates the caller's policies for {@code action} on {@code resource}.
     *
     * @return true if the caller is root or a policy allows the request
     * @throws InvalidParameterException if the caller is not a user, or a stored policy is malformed
     *                                   and {@link MalformedPolicyHandling#FAIL_CLOSED} is set
     */
    public boolean authorize(WamiContext context, String action, WamiArn resource) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resource, "resource");

        if (context.isRoot()) {
            log.debug("Root caller {} bypasses policy evaluation for {}", context.callerArn(), action);
            metrics.record(Outcome.ROOT_BYPASS, action);
            return true;
        }

        String userId = Principals.userId(context.callerArn());
        String resourceArn = resource.toString();
        log.debug("Authorizing user {} for {} on {}", userId, action, resourceArn);

        for (String policyArn : policyStore.listAttachedUserPolicies(userId)) {
            Optional<ManagedPolicy> policy = policyStore.getPolicy(policyArn);
            if (policy.isEmpty()) {
                log.debug("Attached policy {} of user {} no longer exists", policyArn, userId);
                continue;
            }
            PolicyDecision decision = evaluate(policyArn, policy.get().policyDocument(), action, resourceArn);
            if (decision != PolicyDecision.NO_MATCH) {
                return decide(context, action, resourceArn, policyArn, decision);
            }
        }

        for (String policyName : policyStore.listUserPolicies(userId)) {
            Optional<String> json = policyStore.getUserPolicy(userId, policyName);
            if (json.isEmpty()) {
                continue;
            }
            PolicyDecision decision = evaluate(policyName, json.get(), action, resourceArn);
            if (decision != PolicyDecision.NO_MATCH) {
                return decide(context, action, resourceArn, policyName, decision);
            }
        }

        log.warn("Implicit deny: no policy grants {} on {} to {}", action, resourceArn, context.callerArn());
        metrics.record(Outcome.IMPLICIT_DENY, action);
        return false;
    }

    /**
     * Like {@link #authorize} but raises on refusal.
     *
     * @throws AccessDeniedException naming the caller, action and resource when not authorized
     */
    public void checkOrDeny(WamiContext context, String action, WamiArn resource) {
        if (!authorize(context, action, resource)) {
            throw new AccessDeniedException(context.callerArn().toString(), action, resource.toString());
        }
    }

    private PolicyDecision evaluate(String source, String json, String action, String resourceArn) {
        log.debug("Evaluating policy {}", source);
        return PolicyEvaluationEngine.evaluateDocument(parse(source, json), action, resourceArn);
    }

    private PolicyDocument parse(String source, String json) {
        try {
            return PolicyDocuments.parse(json);
        } catch (InvalidParameterException e) {
            if (properties.malformedPolicy() == MalformedPolicyHandling.FAIL_CLOSED) {
                throw new InvalidParameterException("Stored policy " + source + " is malformed", e);
            }
            log.warn("Stored policy {} is malformed, evaluating it as an empty document", source, e);
            return PolicyDocuments.empty();
        }
    }

    private boolean decide(
            WamiContext context, String action, String resourceArn, String source, PolicyDecision decision) {
        if (decision == PolicyDecision.DENY) {
            log.warn("Explicit deny by {}: {} on {} for {}", source, action, resourceArn, context.callerArn());
            metrics.record(Outcome.EXPLICIT_DENY, action);
            return false;
        }
        log.info("Allowed by {}: {} on {} for {}", source, action, resourceArn, context.callerArn());
        metrics.record(Outcome.ALLOW, action);
        return true;
    }
}
