package com.wami.common;

/**
 * Thrown when a referenced tenant, parent tenant or policy is absent from the collaborator store.
 *
 * <p>Distinct from {@link AccessDeniedException}: "not found" says nothing about permissions.
 */
public class ResourceNotFoundException extends WamiException {

    private final String resource;

    public ResourceNotFoundException(String resource) {
        super(ErrorKind.RESOURCE_NOT_FOUND, "Resource not found: %s".formatted(resource));
        this.resource = resource;
    }

    /** Description of the missing resource (e.g., "Tenant acme/eng"). */
    public String resource() {
        return resource;
    }
}
