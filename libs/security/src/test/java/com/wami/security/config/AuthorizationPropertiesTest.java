package com.wami.security.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthorizationProperties")
class AuthorizationPropertiesTest {

    @Test
    @DisplayName("unset properties fall back to defaults")
    void defaults() {
        AuthorizationProperties properties = new AuthorizationProperties(null, null);

        assertThat(properties.malformedPolicy()).isEqualTo(MalformedPolicyHandling.EMPTY_DOCUMENT);
        assertThat(properties.metricsEnabled()).isTrue();
        assertThat(AuthorizationProperties.defaults()).isEqualTo(properties);
    }

    @Test
    @DisplayName("explicit values are kept")
    void explicit() {
        AuthorizationProperties properties = new AuthorizationProperties(MalformedPolicyHandling.FAIL_CLOSED, false);

        assertThat(properties.malformedPolicy()).isEqualTo(MalformedPolicyHandling.FAIL_CLOSED);
        assertThat(properties.metricsEnabled()).isFalse();
    }
}
