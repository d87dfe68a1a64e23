package com.wami.security.config;

import com.wami.policy.store.PolicyStore;
import com.wami.security.AuthorizationMetrics;
import com.wami.security.AuthorizationService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for {@link AuthorizationService}.
 *
 * <p>The host application supplies the {@link PolicyStore} bean. A {@link MeterRegistry} bean is
 * used when present; otherwise decisions are counted in a private registry.
 */
@Configuration
@EnableConfigurationProperties(AuthorizationProperties.class)
public class AuthorizationConfiguration {

    @Bean
    public AuthorizationMetrics authorizationMetrics(
            AuthorizationProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        if (!properties.metricsEnabled()) {
            return AuthorizationMetrics.disabled();
        }
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new AuthorizationMetrics(registry) : AuthorizationMetrics.standalone();
    }

    @Bean
    public AuthorizationService authorizationService(
            PolicyStore policyStore, AuthorizationProperties properties, AuthorizationMetrics metrics) {
        return new AuthorizationService(policyStore, properties, metrics);
    }
}
