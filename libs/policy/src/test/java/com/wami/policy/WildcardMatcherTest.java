package com.wami.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WildcardMatcher")
class WildcardMatcherTest {

    @Test
    @DisplayName("prefix pattern matches same-prefix actions only")
    void prefixPattern() {
        assertThat(WildcardMatcher.matches("s3:Get*", "s3:GetObject")).isTrue();
        assertThat(WildcardMatcher.matches("s3:Get*", "s3:GetBucketLocation")).isTrue();
        assertThat(WildcardMatcher.matches("s3:Get*", "s3:PutObject")).isFalse();
        assertThat(WildcardMatcher.matches("s3:Get*", "ec2:GetObject")).isFalse();
    }

    @Test
    @DisplayName("bare * matches anything, including the empty string")
    void bareWildcard() {
        assertThat(WildcardMatcher.matches("*", "iam:CreateUser")).isTrue();
        assertThat(WildcardMatcher.matches("*", "")).isTrue();
    }

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "iam:GetUser, iam:GetUser, true",
            "iam:GetUser, iam:GetUsers, false",
            "*User, iam:GetUser, true",
            "*User, iam:GetUsers, false",
            "arn:wami:iam:*:user/*, arn:wami:iam:1/2:wami:9:user/alice, true",
            "arn:wami:iam:*:user/*, arn:wami:iam:1/2:wami:9:role/alice, false",
            "a*b*c, abc, true",
            "a*b*c, aXbYc, true",
            "a*b*c, acb, false",
            "a*a, a, false",
            "a*a, aa, true",
            "ab*bc, abc, false",
            "**, x, true"
    })
    @DisplayName("segments are consumed in order without overlap")
    void segments(String pattern, String value, boolean expected) {
        assertThat(WildcardMatcher.matches(pattern, value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("matchesAny() needs one matching pattern")
    void matchesAny() {
        assertThat(WildcardMatcher.matchesAny(List.of("iam:Get*", "sts:*"), "sts:AssumeRole")).isTrue();
        assertThat(WildcardMatcher.matchesAny(List.of("iam:Get*", "sts:*"), "iam:DeleteUser")).isFalse();
        assertThat(WildcardMatcher.matchesAny(List.of(), "iam:GetUser")).isFalse();
    }
}
