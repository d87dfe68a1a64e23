package com.wami.security;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Set;

/**
 * Counts authorization decisions in a Micrometer registry.
 * <p>
 * Every decision increments {@value #DECISIONS} tagged with its {@link Outcome} and the service
 * namespace of the action ({@code iam} for {@code iam:GetUser}). Actions come from callers, so
 * namespaces outside {@link #KNOWN_SERVICES} share the {@value #OTHER_SERVICE} tag and the number
 * of counters stays fixed.
 */
public final class AuthorizationMetrics {

    /** Counter of authorization decisions. */
    public static final String DECISIONS = "wami.authorization.decisions";

    /** Tag key for the decision outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /** Tag key for the action's service namespace. */
    public static final String TAG_SERVICE = "service";

    /** Service tag of actions whose namespace is not in {@link #KNOWN_SERVICES}. */
    public static final String OTHER_SERVICE = "other";

    /** Namespaces tagged under their own name. */
    public static final Set<String> KNOWN_SERVICES = Set.of(
            "iam", "sts", "sso-admin", "tenant", "s3", "ec2", "lambda", "dynamodb", "sqs", "sns", "kms",
            "logs", "cloudwatch", "compute", "storage");

    /** How a single check was decided. */
    public enum Outcome {
        ROOT_BYPASS("root_bypass"),
        ALLOW("allow"),
        EXPLICIT_DENY("explicit_deny"),
        IMPLICIT_DENY("implicit_deny");

        private final String tagValue;

        Outcome(String tagValue) {
            this.tagValue = tagValue;
        }

        public String tagValue() {
            return tagValue;
        }
    }

    private final MeterRegistry registry;
    private final boolean enabled;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry the Micrometer meter registry
     */
    public AuthorizationMetrics(MeterRegistry registry) {
        this(registry, true);
    }

    private AuthorizationMetrics(MeterRegistry registry, boolean enabled) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.enabled = enabled;
    }

    /** Metrics kept in a private {@link SimpleMeterRegistry}, for use without a host registry. */
    public static AuthorizationMetrics standalone() {
        return new AuthorizationMetrics(new SimpleMeterRegistry());
    }

    /** Metrics that record nothing. */
    public static AuthorizationMetrics disabled() {
        return new AuthorizationMetrics(new SimpleMeterRegistry(), false);
    }

    /** Records one decision for {@code action}. */
    public void record(Outcome outcome, String action) {
        if (!enabled) {
            return;
        }
        Counter.builder(DECISIONS)
                .description("Authorization decisions by outcome")
                .tags(TAG_OUTCOME, outcome.tagValue(), TAG_SERVICE, serviceOf(action))
                .register(registry)
                .increment();
    }

    /** The registry decisions are recorded into. */
    public MeterRegistry registry() {
        return registry;
    }

    static String serviceOf(String action) {
        int colon = action.indexOf(':');
        String namespace = colon < 0 ? action : action.substring(0, colon);
        return KNOWN_SERVICES.contains(namespace) ? namespace : OTHER_SERVICE;
    }
}
