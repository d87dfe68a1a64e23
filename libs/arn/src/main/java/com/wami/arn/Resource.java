package com.wami.arn;

import java.util.Objects;

/**
 * The resource addressed by an ARN.
 *
 * <p>The type is non-empty and free of {@code :} and {@code /}; the id is non-empty.
 *
 * @param resourceType resource kind (e.g., "user", "policy")
 * @param resourceId   identifier; may itself contain {@code /} (e.g., policy paths)
 */
public record Resource(String resourceType, String resourceId) {

    public Resource {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(resourceId, "resourceId");
        ArnComponents.requireToken(resourceType, "resource_type", ':', '/');
        ArnComponents.requireNonEmpty(resourceId, "resource_id");
    }

    /** {@code type/id}. */
    public String asPath() {
        return resourceType + "/" + resourceId;
    }

    @Override
    public String toString() {
        return asPath();
    }
}
