package com.wami.arn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wami.common.ErrorKind;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("ArnParser")
class ArnParserTest {

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("native ARN")
        void nativeArn() {
            var arn = WamiArn.parse("arn:wami:iam:12345678/87654321:wami:999888777:user/77557755");

            assertThat(arn.service()).isEqualTo(Service.IAM);
            assertThat(arn.tenantPath()).isEqualTo(TenantPath.of(12345678, 87654321));
            assertThat(arn.wamiInstanceId()).isEqualTo("999888777");
            assertThat(arn.isCloudSynced()).isFalse();
            assertThat(arn.resource()).isEqualTo(new Resource("user", "77557755"));
        }

        @Test
        @DisplayName("regional cloud ARN; 'global' maps to an absent region")
        void regional() {
            var regional = WamiArn.parse("arn:wami:iam:1:wami:9:aws:223344556677:us-east-1:user/u1");
            var global = WamiArn.parse("arn:wami:iam:1:wami:9:aws:223344556677:global:user/u1");

            assertThat(regional.cloudMapping()).isEqualTo(CloudMapping.withRegion("aws", "223344556677", "us-east-1"));
            assertThat(global.cloudMapping()).isEqualTo(CloudMapping.of("aws", "223344556677"));
        }

        @Test
        @DisplayName("legacy cloud ARN without region is accepted and re-written in region form")
        void legacy() {
            var arn = WamiArn.parse("arn:wami:iam:1:wami:9:aws:223344556677:user/u1");

            assertThat(arn.cloudMapping()).isEqualTo(CloudMapping.of("aws", "223344556677"));
            assertThat(arn).hasToString("arn:wami:iam:1:wami:9:aws:223344556677:global:user/u1");
        }

        @Test
        @DisplayName("resource id keeps slashes after the first one")
        void resourceIdSlashes() {
            var arn = WamiArn.parse("arn:wami:iam:1:wami:9:policy/team/a/b");
            assertThat(arn.resourceType()).isEqualTo("policy");
            assertThat(arn.resourceId()).isEqualTo("team/a/b");
        }

        @Test
        @DisplayName("unknown service tokens become custom services")
        void customService() {
            var arn = WamiArn.parse("arn:wami:billing:1:wami:9:invoice/42");
            assertThat(arn.service()).isEqualTo(Service.custom("billing"));
            assertThat(WamiArn.parse("arn:wami:sso-admin:1:wami:9:instance/1").service())
                    .isEqualTo(Service.SSO_ADMIN);
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("too few segments")
        void tooFew() {
            assertThatThrownBy(() -> WamiArn.parse("arn:wami:iam"))
                    .isInstanceOf(ArnParseException.class)
                    .hasMessageContaining("at least 7 parts");
        }

        @Test
        @DisplayName("wrong literal tokens are format errors")
        void literals() {
            assertKind("xrn:wami:iam:1:wami:9:user/u", ErrorKind.INVALID_FORMAT);
            assertKind("arn:aws:iam:1:wami:9:user/u", ErrorKind.INVALID_FORMAT);
            assertKind("arn:wami:iam:1:wamy:9:user/u", ErrorKind.INVALID_FORMAT);
        }

        @Test
        @DisplayName("component errors")
        void components() {
            assertKind("arn:wami:iam:t1/t2:wami:9:user/u", ErrorKind.INVALID_COMPONENT);
            assertKind("arn:wami:iam::wami:9:user/u", ErrorKind.INVALID_COMPONENT);
            assertKind("arn:wami:iam:1:wami::user/u", ErrorKind.MISSING_COMPONENT);
            assertKind("arn:wami::1:wami:9:user/u", ErrorKind.MISSING_COMPONENT);
            assertKind("arn:wami:iam:1:wami:9:user", ErrorKind.INVALID_FORMAT);
            assertKind("arn:wami:iam:1:wami:9:user/", ErrorKind.INVALID_COMPONENT);
            assertKind("arn:wami:iam:1:wami:9:/u", ErrorKind.INVALID_COMPONENT);
            assertKind("arn:wami:iam:1:wami:9::acct:global:user/u", ErrorKind.INVALID_COMPONENT);
        }

        @Test
        @DisplayName("a resource type holding ':' is a component error")
        void colonInResourceType() {
            assertKind("arn:wami:iam:1:wami:9:aws:123:a/b:user/u", ErrorKind.INVALID_COMPONENT);
            assertKind("arn:wami:iam:1:wami:9:aws:123:us-east-1:x:user/u", ErrorKind.INVALID_COMPONENT);
        }

        private void assertKind(String arn, ErrorKind kind) {
            assertThatThrownBy(() -> WamiArn.parse(arn))
                    .isInstanceOf(ArnParseException.class)
                    .satisfies(e -> assertThat(((ArnParseException) e).kind()).isEqualTo(kind));
        }
    }

    @Nested
    @DisplayName("classifyLayout()")
    class Layouts {

        static Stream<Arguments> layouts() {
            return Stream.of(
                    // 7 segments: always native
                    Arguments.of("arn:wami:iam:1:wami:9:user/u", ArnParser.Layout.NATIVE),
                    // 8 segments: native, the id carries one colon
                    Arguments.of("arn:wami:iam:1:wami:9:user/aws:123", ArnParser.Layout.NATIVE),
                    // 9 segments, slash-free provider/account: legacy cloud form
                    Arguments.of("arn:wami:iam:1:wami:9:aws:123:user/u", ArnParser.Layout.CLOUD_LEGACY),
                    // 9 segments, but segment 6 is the type/ part: native id that looks like provider:account
                    Arguments.of("arn:wami:iam:1:wami:9:user/aws:123:global", ArnParser.Layout.NATIVE),
                    // 10 segments, slash-free provider/account/region: regional cloud form
                    Arguments.of("arn:wami:iam:1:wami:9:aws:123:us-east-1:user/u", ArnParser.Layout.CLOUD_REGIONAL),
                    // 10 segments, segment 6 carries the slash: native
                    Arguments.of("arn:wami:iam:1:wami:9:user/aws:123:global:x", ArnParser.Layout.NATIVE),
                    // 10 segments with a slash in the region slot: native, never legacy
                    Arguments.of("arn:wami:iam:1:wami:9:aws:123:a/b:user/u", ArnParser.Layout.NATIVE),
                    // 11 segments: regional cloud form whose id contains a colon
                    Arguments.of("arn:wami:iam:1:wami:9:aws:123:global:user/a:b", ArnParser.Layout.CLOUD_REGIONAL));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("layouts")
        @DisplayName("segment-count thresholds")
        void classify(String arn, ArnParser.Layout expected) {
            assertThat(ArnParser.classifyLayout(arn.split(":", -1))).isEqualTo(expected);
        }

        @Test
        @DisplayName("native id that looks like a cloud segment parses as native")
        void adversarialNative() {
            var arn = WamiArn.parse("arn:wami:iam:1:wami:9:user/aws:123:global");
            assertThat(arn.isCloudSynced()).isFalse();
            assertThat(arn.resourceId()).isEqualTo("aws:123:global");
            assertThat(WamiArn.parse(arn.toString())).isEqualTo(arn);
        }
    }

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @Test
        @DisplayName("parse(toString(x)) == x for built ARNs")
        void roundTrip() {
            var base = WamiArn.builder()
                    .service(Service.STS)
                    .tenantHierarchy(12345678, 87654321)
                    .wamiInstance("999888777")
                    .resource("assumed-role", "Admin/session:1");

            var nativeArn = base.build();
            var global = base.cloudProvider("gcp", "my-project").build();
            var regional = base.cloudProviderWithRegion("azure", "sub-1", "westeurope").build();

            for (WamiArn arn : new WamiArn[] {nativeArn, global, regional}) {
                assertThat(WamiArn.parse(arn.toString())).isEqualTo(arn);
            }
        }

        @Test
        @DisplayName("a custom service spelled like a built-in resolves to the built-in")
        void customBuiltInToken() {
            assertThat(Service.custom("iam")).isSameAs(Service.IAM);
            assertThat(Service.custom("sso-admin").kind()).isEqualTo(Service.Kind.SSO_ADMIN);

            var arn = WamiArn.builder()
                    .service(Service.custom("sts"))
                    .tenant(12345678)
                    .wamiInstance("999888777")
                    .resource("assumed-role", "Admin")
                    .build();

            assertThat(WamiArn.parse(arn.toString())).isEqualTo(arn);
            assertThat(arn.service()).isEqualTo(Service.STS);
        }
    }
}
