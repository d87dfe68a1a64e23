package com.wami.tenant;

import com.wami.arn.TenantPath;
import com.wami.common.InvalidParameterException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Hierarchical tenant identifier: {@code acme}, {@code acme/engineering},
 * {@code acme/engineering/platform}.
 *
 * <p>WHY a record around a string: ids are map keys in every store and are compared by value. The
 * hierarchy is implied by the string itself, so no lookup is needed to find a parent or test
 * descent.
 *
 * @param value {@code /}-joined segments, root first; no segment is empty
 */
public record TenantId(String value) {

    static final String SEPARATOR = "/";

    public TenantId {
        if (value == null || value.isEmpty()) {
            throw new InvalidParameterException("Tenant ID cannot be empty");
        }
        for (String segment : value.split(SEPARATOR, -1)) {
            if (segment.isEmpty()) {
                throw new InvalidParameterException("Tenant ID has an empty segment: '%s'".formatted(value));
            }
        }
    }

    /** Wraps an existing id string. */
    public static TenantId of(String value) {
        return new TenantId(value);
    }

    /** Creates a root id from a single segment. */
    public static TenantId root(String name) {
        requireSegment(name);
        return new TenantId(name);
    }

    /** Converts an ARN tenant path. Every segment becomes its unsigned decimal form. */
    public static TenantId fromTenantPath(TenantPath path) {
        return new TenantId(path.toString());
    }

    /** Appends one level below this id. */
    public TenantId child(String name) {
        requireSegment(name);
        return new TenantId(value + SEPARATOR + name);
    }

    /** The enclosing tenant, or empty for a root id. */
    public Optional<TenantId> parent() {
        int slash = value.lastIndexOf('/');
        return slash < 0 ? Optional.empty() : Optional.of(new TenantId(value.substring(0, slash)));
    }

    public boolean isRoot() {
        return value.indexOf('/') < 0;
    }

    /** Distance from the root: 0 for a root id, 1 for its children, and so on. */
    public int depth() {
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    /** Segments, root first. */
    public List<String> segments() {
        return List.of(value.split(SEPARATOR));
    }

    /** Every strict prefix of this id, root first, ending with the parent. Empty for a root id. */
    public List<TenantId> ancestors() {
        String[] parts = value.split(SEPARATOR);
        List<TenantId> ancestors = new ArrayList<>(parts.length - 1);
        for (int i = 1; i < parts.length; i++) {
            ancestors.add(new TenantId(String.join(SEPARATOR, Arrays.copyOfRange(parts, 0, i))));
        }
        return ancestors;
    }

    /** True when this id lies strictly below {@code other}. */
    public boolean isDescendantOf(TenantId other) {
        return value.startsWith(other.value + SEPARATOR);
    }

    /**
     * Converts to an ARN tenant path.
     *
     * @throws InvalidParameterException if a segment is not an unsigned 64-bit integer
     */
    public TenantPath toTenantPath() {
        List<Long> segments = new ArrayList<>();
        for (String segment : segments()) {
            if (!Character.isDigit(segment.charAt(0))) {
                throw notNumeric(segment);
            }
            try {
                segments.add(Long.parseUnsignedLong(segment));
            } catch (NumberFormatException e) {
                throw notNumeric(segment);
            }
        }
        return new TenantPath(segments);
    }

    private InvalidParameterException notNumeric(String segment) {
        return new InvalidParameterException(
                "Tenant ID '%s' has a non-numeric segment '%s' and has no ARN tenant path".formatted(value, segment));
    }

    private static void requireSegment(String name) {
        if (name == null || name.isEmpty() || name.contains(SEPARATOR)) {
            throw new InvalidParameterException(
                    "Tenant ID segment must be non-empty and must not contain '/': '%s'".formatted(name));
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
