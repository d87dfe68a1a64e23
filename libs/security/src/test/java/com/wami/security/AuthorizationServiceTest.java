package com.wami.security;

import com.wami.arn.TenantPath;
import com.wami.arn.WamiArn;
import com.wami.common.AccessDeniedException;
import com.wami.common.ErrorKind;
import com.wami.common.InvalidParameterException;
import com.wami.policy.store.ManagedPolicy;
import com.wami.policy.store.PolicyStore;
import com.wami.policy.testing.InMemoryPolicyStore;
import com.wami.security.config.AuthorizationProperties;
import com.wami.security.config.MalformedPolicyHandling;
import com.wami.security.testing.TestWamiContextFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("AuthorizationService")
class AuthorizationServiceTest {

    private static final String USER_ID = "77557755";
    private static final WamiArn BUCKET = WamiArn.parse("arn:wami:iam:12345678:wami:999888777:bucket/reports");

    private final WamiContext caller = TestWamiContextFactory.create();

    private InMemoryPolicyStore store;
    private SimpleMeterRegistry registry;
    private AuthorizationService service;

    private static String policy(String effect, String action, String resource) {
        return """
                {"Version":"2012-10-17","Statement":[{"Effect":"%s","Action":"%s","Resource":"%s"}]}"""
                .formatted(effect, action, resource);
    }

    private static String allow(String action) {
        return policy("Allow", action, "*");
    }

    private static String deny(String action) {
        return policy("Deny", action, "*");
    }

    private AuthorizationService service(MalformedPolicyHandling handling) {
        return new AuthorizationService(store, new AuthorizationProperties(handling, true),
                new AuthorizationMetrics(registry));
    }

    private double decisions(String outcome, String serviceTag) {
        return registry.get(AuthorizationMetrics.DECISIONS)
                .tags(AuthorizationMetrics.TAG_OUTCOME, outcome, AuthorizationMetrics.TAG_SERVICE, serviceTag)
                .counter()
                .count();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryPolicyStore();
        registry = new SimpleMeterRegistry();
        service = service(MalformedPolicyHandling.EMPTY_DOCUMENT);
    }

    @Nested
    @DisplayName("root callers")
    class Root {

        @Test
        @DisplayName("are allowed with no policies and no store lookup")
        void bypass() {
            PolicyStore untouched = mock(PolicyStore.class);
            AuthorizationService rootService = new AuthorizationService(untouched,
                    AuthorizationProperties.defaults(), new AuthorizationMetrics(registry));

            assertThat(rootService.authorize(TestWamiContextFactory.root(), "iam:DeleteUser", BUCKET)).isTrue();
            assertThat(rootService.authorize(TestWamiContextFactory.root(), "s3:PutObject", BUCKET)).isTrue();
            verifyNoInteractions(untouched);
            assertThat(decisions("root_bypass", "iam")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("policy evaluation")
    class Evaluation {

        @Test
        @DisplayName("no policies is an implicit deny")
        void implicitDeny() {
            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isFalse();
            assertThat(decisions("implicit_deny", "s3")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("attached managed policy grants a matching action")
        void attachedAllow() {
            store.attachPolicy(USER_ID, "arn:wami:iam:12345678:wami:999888777:policy/S3Read", allow("s3:Get*"));

            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isTrue();
            assertThat(service.authorize(caller, "s3:PutObject", BUCKET)).isFalse();
            assertThat(decisions("allow", "s3")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("inline policy grants a matching action")
        void inlineAllow() {
            store.putUserPolicy(USER_ID, "read-reports",
                    policy("Allow", "s3:GetObject", "arn:wami:iam:12345678:wami:999888777:bucket/*"));

            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isTrue();
        }

        @Test
        @DisplayName("resource patterns are matched against the canonical ARN")
        void resourceMismatch() {
            store.putUserPolicy(USER_ID, "other-tenant",
                    policy("Allow", "s3:*", "arn:wami:iam:99999999:wami:999888777:bucket/*"));

            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isFalse();
        }

        @Test
        @DisplayName("deny overrides allow inside one document")
        void denyOverridesAllow() {
            store.putUserPolicy(USER_ID, "s3", """
                    {"Version":"2012-10-17","Statement":[
                      {"Effect":"Allow","Action":"s3:*","Resource":"*"},
                      {"Effect":"Deny","Action":"s3:DeleteObject","Resource":"*"}]}""");

            assertThat(service.authorize(caller, "s3:DeleteObject", BUCKET)).isFalse();
            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isTrue();
            assertThat(decisions("explicit_deny", "s3")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a deny in an earlier policy ends the check")
        void earlierDenyWins() {
            store.attachPolicy(USER_ID, "policy/deny-delete", deny("s3:DeleteObject"))
                    .attachPolicy(USER_ID, "policy/allow-all", allow("*"));

            assertThat(service.authorize(caller, "s3:DeleteObject", BUCKET)).isFalse();
            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isTrue();
        }

        @Test
        @DisplayName("an allow in an earlier policy ends the check before a later deny")
        void earlierAllowWins() {
            store.attachPolicy(USER_ID, "policy/allow-all", allow("*"))
                    .putUserPolicy(USER_ID, "deny-delete", deny("s3:DeleteObject"));

            assertThat(service.authorize(caller, "s3:DeleteObject", BUCKET)).isTrue();
        }

        @Test
        @DisplayName("later policies are not read once a policy decides")
        void shortCircuit() {
            PolicyStore mockStore = mock(PolicyStore.class);
            when(mockStore.listAttachedUserPolicies(USER_ID)).thenReturn(List.of("p1", "p2"));
            when(mockStore.getPolicy("p1")).thenReturn(Optional.of(
                    new ManagedPolicy("p1", "p1", deny("s3:*"))));

            AuthorizationService shortCircuiting = new AuthorizationService(mockStore);

            assertThat(shortCircuiting.authorize(caller, "s3:GetObject", BUCKET)).isFalse();
            verify(mockStore, never()).getPolicy("p2");
            verify(mockStore, never()).listUserPolicies(anyString());
        }

        @Test
        @DisplayName("dangling attachment is skipped")
        void danglingAttachment() {
            store.attach(USER_ID, "policy/gone")
                    .putUserPolicy(USER_ID, "read", allow("s3:GetObject"));

            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isTrue();
        }

        @Test
        @DisplayName("non-user caller is rejected")
        void nonUserCaller() {
            TenantPath tenant = TenantPath.single(12345678L);
            WamiContext roleCaller = TestWamiContextFactory.builder(tenant,
                    WamiArn.parse("arn:wami:iam:12345678:wami:999888777:role/Admin")).build();

            assertThatThrownBy(() -> service.authorize(roleCaller, "s3:GetObject", BUCKET))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("not a user ARN");
        }

        @Test
        @DisplayName("store failure propagates instead of granting")
        void storeFailure() {
            PolicyStore failing = mock(PolicyStore.class);
            when(failing.listAttachedUserPolicies(USER_ID)).thenThrow(new IllegalStateException("store offline"));

            AuthorizationService failingService = new AuthorizationService(failing);

            assertThatThrownBy(() -> failingService.authorize(caller, "s3:GetObject", BUCKET))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("store offline");
        }
    }

    @Nested
    @DisplayName("malformed stored policies")
    class Malformed {

        @BeforeEach
        void storeMalformedPolicy() {
            store.attachPolicy(USER_ID, "policy/broken", "{not json")
                    .putUserPolicy(USER_ID, "read", allow("s3:GetObject"));
        }

        @Test
        @DisplayName("are evaluated as empty documents by default")
        void emptyDocument() {
            assertThat(service.authorize(caller, "s3:GetObject", BUCKET)).isTrue();
            assertThat(service.authorize(caller, "s3:PutObject", BUCKET)).isFalse();
        }

        @Test
        @DisplayName("fail the check when configured fail-closed")
        void failClosed() {
            AuthorizationService strict = service(MalformedPolicyHandling.FAIL_CLOSED);

            assertThatThrownBy(() -> strict.authorize(caller, "s3:GetObject", BUCKET))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("policy/broken");
        }
    }

    @Nested
    @DisplayName("checkOrDeny()")
    class CheckOrDeny {

        @Test
        @DisplayName("returns normally when allowed")
        void allowed() {
            store.putUserPolicy(USER_ID, "read", allow("s3:GetObject"));

            service.checkOrDeny(caller, "s3:GetObject", BUCKET);
        }

        @Test
        @DisplayName("raises access denied naming caller, action and resource")
        void denied() {
            assertThatThrownBy(() -> service.checkOrDeny(caller, "s3:DeleteObject", BUCKET))
                    .isInstanceOfSatisfying(AccessDeniedException.class, e -> {
                        assertThat(e.kind()).isEqualTo(ErrorKind.ACCESS_DENIED);
                        assertThat(e.principal()).isEqualTo(caller.callerArn().toString());
                        assertThat(e.action()).isEqualTo("s3:DeleteObject");
                        assertThat(e.resource()).isEqualTo(BUCKET.toString());
                    })
                    .hasMessage("User arn:wami:iam:12345678:wami:999888777:user/77557755 is not authorized"
                            + " to perform s3:DeleteObject on arn:wami:iam:12345678:wami:999888777:bucket/reports");
        }
    }
}
