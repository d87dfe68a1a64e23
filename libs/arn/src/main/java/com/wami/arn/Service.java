package com.wami.arn;

import java.util.Objects;

/**
 * The service namespace of an ARN ({@code iam}, {@code sts}, {@code sso-admin}, or any other
 * token).
 *
 * <p>WHY not a plain enum: unknown tokens must survive a parse/format round trip, so a custom
 * service keeps its original token. {@link #kind()} gives callers an exhaustive switch.
 */
public final class Service {

    /** Service families. */
    public enum Kind {
        IAM,
        STS,
        SSO_ADMIN,
        CUSTOM
    }

    public static final Service IAM = new Service(Kind.IAM, "iam");
    public static final Service STS = new Service(Kind.STS, "sts");
    public static final Service SSO_ADMIN = new Service(Kind.SSO_ADMIN, "sso-admin");

    private final Kind kind;
    private final String value;

    private Service(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Looks up a service by its ARN token. Unrecognized tokens become {@link Kind#CUSTOM} services
     * that keep the token verbatim.
     */
    public static Service of(String token) {
        return switch (token) {
            case "iam" -> IAM;
            case "sts" -> STS;
            case "sso-admin" -> SSO_ADMIN;
            default -> new Service(Kind.CUSTOM, token);
        };
    }

    /**
     * Creates a service carrying an arbitrary token. A built-in token resolves to its built-in
     * service, the same value a parse of that token yields.
     */
    public static Service custom(String name) {
        return of(Objects.requireNonNull(name, "name"));
    }

    public Kind kind() {
        return kind;
    }

    /** The ARN token (e.g., "sso-admin"). */
    public String value() {
        return value;
    }

    public boolean isCustom() {
        return kind == Kind.CUSTOM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Service other)) {
            return false;
        }
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return value;
    }
}
