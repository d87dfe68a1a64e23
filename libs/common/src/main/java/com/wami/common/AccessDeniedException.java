package com.wami.common;

/**
 * Thrown when an authorization check explicitly refuses a request.
 *
 * <p>Carries the caller, the action and the resource so that the refusal can be diagnosed
 * without re-running the check.
 */
public class AccessDeniedException extends WamiException {

    private final String principal;
    private final String action;
    private final String resource;

    public AccessDeniedException(String principal, String action, String resource) {
        this("User %s is not authorized to perform %s on %s".formatted(principal, action, resource),
                principal, action, resource);
    }

    protected AccessDeniedException(String message, String principal, String action, String resource) {
        super(ErrorKind.ACCESS_DENIED, message);
        this.principal = principal;
        this.action = action;
        this.resource = resource;
    }

    public String principal() {
        return principal;
    }

    public String action() {
        return action;
    }

    public String resource() {
        return resource;
    }
}
