package com.wami.security.config;

import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;
import com.wami.policy.store.PolicyStore;
import com.wami.policy.testing.InMemoryPolicyStore;
import com.wami.security.AuthorizationMetrics;
import com.wami.security.AuthorizationService;
import com.wami.security.testing.TestWamiContextFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthorizationConfiguration")
class AuthorizationConfigurationTest {

    private static final WamiArn BUCKET = WamiArn.parse("arn:wami:iam:12345678:wami:999888777:bucket/reports");

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(AuthorizationConfiguration.class)
            .withBean(PolicyStore.class, () -> new InMemoryPolicyStore()
                    .attachPolicy("77557755", "policy/broken", "{not json"));

    @Test
    @DisplayName("is a configuration that enables the authorization properties")
    void annotations() {
        assertThat(AuthorizationConfiguration.class.isAnnotationPresent(Configuration.class)).isTrue();
        assertThat(AuthorizationConfiguration.class.getAnnotation(EnableConfigurationProperties.class).value())
                .containsExactly(AuthorizationProperties.class);
    }

    @Test
    @DisplayName("wires the service with default properties")
    void defaults() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(AuthorizationService.class);
            assertThat(context.getBean(AuthorizationProperties.class))
                    .isEqualTo(AuthorizationProperties.defaults());

            AuthorizationService service = context.getBean(AuthorizationService.class);
            assertThat(service.authorize(TestWamiContextFactory.create(), "s3:GetObject", BUCKET)).isFalse();
        });
    }

    @Test
    @DisplayName("binds wami.authorization properties")
    void binding() {
        runner.withPropertyValues(
                        "wami.authorization.malformed-policy=fail_closed",
                        "wami.authorization.metrics-enabled=false")
                .run(context -> {
                    AuthorizationProperties properties = context.getBean(AuthorizationProperties.class);
                    assertThat(properties.malformedPolicy()).isEqualTo(MalformedPolicyHandling.FAIL_CLOSED);
                    assertThat(properties.metricsEnabled()).isFalse();

                    AuthorizationService service = context.getBean(AuthorizationService.class);
                    assertThatThrownBy(() -> service.authorize(
                            TestWamiContextFactory.create(), "s3:GetObject", BUCKET))
                            .isInstanceOf(InvalidParameterException.class);
                });
    }

    @Test
    @DisplayName("records decisions in the application's meter registry when present")
    void hostRegistry() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    context.getBean(AuthorizationService.class)
                            .authorize(TestWamiContextFactory.root(), "iam:GetUser", BUCKET);

                    assertThat(context.getBean(AuthorizationMetrics.class).registry()).isSameAs(registry);
                    assertThat(registry.get(AuthorizationMetrics.DECISIONS)
                            .tags("outcome", "root_bypass").counter().count()).isEqualTo(1.0);
                });
    }
}
