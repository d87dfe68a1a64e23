package com.wami.security.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings for {@link com.wami.security.AuthorizationService}.
 *
 * <p>WHY a record with defaults in the compact constructor: the service also runs outside Spring
 * (tests, embedded use) and must behave the same with no configuration at all. Unset properties
 * bind as {@code null} and fall back here.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * wami:
 *   authorization:
 *     malformed-policy: FAIL_CLOSED
 *     metrics-enabled: true
 * }</pre>
 *
 * @param malformedPolicy handling of unparseable stored policies (default {@code EMPTY_DOCUMENT})
 * @param metricsEnabled  whether decisions are counted (default {@code true})
 */
@ConfigurationProperties(prefix = "wami.authorization")
public record AuthorizationProperties(MalformedPolicyHandling malformedPolicy, Boolean metricsEnabled) {

    public AuthorizationProperties {
        if (malformedPolicy == null) {
            malformedPolicy = MalformedPolicyHandling.EMPTY_DOCUMENT;
        }
        if (metricsEnabled == null) {
            metricsEnabled = Boolean.TRUE;
        }
    }

    public static AuthorizationProperties defaults() {
        return new AuthorizationProperties(null, null);
    }
}
