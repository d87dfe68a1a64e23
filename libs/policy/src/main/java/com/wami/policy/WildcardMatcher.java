package com.wami.policy;

import java.util.Collection;

/**
 * {@code *}-wildcard matching for action and resource patterns.
 *
 * <p>A pattern without {@code *} matches only the identical string. Otherwise the value must start
 * with the text before the first {@code *}, end with the text after the last {@code *}, and contain
 * each interior segment in order. Segments are consumed left to right and never overlap, so
 * {@code a*a} does not match {@code a}.
 */
public final class WildcardMatcher {

    private static final String WILDCARD = "*";

    private WildcardMatcher() {
        // utility class
    }

    /** True when {@code value} matches {@code pattern}. */
    public static boolean matches(String pattern, String value) {
        if (WILDCARD.equals(pattern)) {
            return true;
        }
        if (pattern.indexOf('*') < 0) {
            return pattern.equals(value);
        }

        String[] parts = pattern.split("\\*", -1);
        String first = parts[0];
        if (!value.startsWith(first)) {
            return false;
        }
        int pos = first.length();

        for (int i = 1; i < parts.length - 1; i++) {
            String part = parts[i];
            if (part.isEmpty()) {
                continue;
            }
            int found = value.indexOf(part, pos);
            if (found < 0) {
                return false;
            }
            pos = found + part.length();
        }

        String last = parts[parts.length - 1];
        return value.length() - last.length() >= pos && value.endsWith(last);
    }

    /** True when at least one of {@code patterns} matches {@code value}. */
    public static boolean matchesAny(Collection<String> patterns, String value) {
        return firstMatch(patterns, value) != null;
    }

    /** The first pattern that matches {@code value}, or {@code null}. */
    static String firstMatch(Collection<String> patterns, String value) {
        for (String pattern : patterns) {
            if (pattern != null && matches(pattern, value)) {
                return pattern;
            }
        }
        return null;
    }
}
