package com.wami.arn;

import com.wami.common.InvalidParameterException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Position of a resource in the tenant hierarchy, from the root tenant down to the owning tenant.
 *
 * <p>WHY a record: immutable value that travels inside every ARN and every context. Segments are
 * unsigned 64-bit tenant numbers; the path is never empty.
 *
 * @param segments tenant numbers, root first (rendered as unsigned decimals joined by {@code /})
 */
public record TenantPath(List<Long> segments) {

    public TenantPath {
        if (segments == null || segments.isEmpty()) {
            throw new InvalidParameterException("Tenant path cannot be empty");
        }
        segments = List.copyOf(segments);
    }

    /** Creates a path from root-first segments. */
    public static TenantPath of(long... segments) {
        List<Long> list = new ArrayList<>(segments.length);
        for (long segment : segments) {
            list.add(segment);
        }
        return new TenantPath(list);
    }

    /** Creates a single-level path. */
    public static TenantPath single(long tenantId) {
        return new TenantPath(List.of(tenantId));
    }

    /**
     * Parses a {@code /}-joined path such as {@code 12345678/87654321}.
     *
     * @throws ArnParseException if the path is empty or a segment is not an unsigned integer
     */
    public static TenantPath parse(String path) {
        if (path == null || path.isEmpty()) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_COMPONENT,
                    "Tenant path cannot be empty");
        }
        List<Long> segments = new ArrayList<>();
        for (String segment : path.split("/", -1)) {
            segments.add(parseSegment(segment));
        }
        return new TenantPath(segments);
    }

    private static long parseSegment(String segment) {
        if (segment.isEmpty() || !Character.isDigit(segment.charAt(0))) {
            throw invalidSegment(segment);
        }
        try {
            return Long.parseUnsignedLong(segment);
        } catch (NumberFormatException e) {
            throw invalidSegment(segment);
        }
    }

    private static ArnParseException invalidSegment(String segment) {
        return new ArnParseException(ArnParseException.Kind.INVALID_COMPONENT,
                "Invalid tenant path segment: '%s' (must be an unsigned integer)".formatted(segment));
    }

    /** Root (first) segment, rendered as an unsigned decimal. */
    public String root() {
        return Long.toUnsignedString(segments.get(0));
    }

    /** Leaf (last) segment, rendered as an unsigned decimal. */
    public String leaf() {
        return Long.toUnsignedString(segments.get(segments.size() - 1));
    }

    /** Number of segments. */
    public int depth() {
        return segments.size();
    }

    /** Appends one level below this path. */
    public TenantPath child(long tenantId) {
        List<Long> list = new ArrayList<>(segments);
        list.add(tenantId);
        return new TenantPath(list);
    }

    /**
     * True when {@code other}'s segments are a prefix of this path's segments. A path starts with
     * itself.
     */
    public boolean startsWith(TenantPath other) {
        if (segments.size() < other.segments.size()) {
            return false;
        }
        return segments.subList(0, other.segments.size()).equals(other.segments);
    }

    /** True when this path lies strictly below {@code other}. */
    public boolean isDescendantOf(TenantPath other) {
        return segments.size() > other.segments.size() && startsWith(other);
    }

    /** True when this path lies strictly above {@code other}. */
    public boolean isAncestorOf(TenantPath other) {
        return other.isDescendantOf(this);
    }

    @Override
    public String toString() {
        return segments.stream().map(Long::toUnsignedString).collect(Collectors.joining("/"));
    }
}
