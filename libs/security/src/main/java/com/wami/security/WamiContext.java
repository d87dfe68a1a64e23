package com.wami.security;

import com.wami.arn.TenantPath;
import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-scoped identity every authorization and tenant-scope check runs against.
 * <p>
 * WHY immutable with a builder: a context is produced once by the authentication step and then
 * travels with the request. Nothing downstream may widen it, so there are no setters and
 * {@link Builder#build()} rejects incomplete contexts.
 * <p>
 * Only the authentication layer should create contexts. Tests use
 * {@link com.wami.security.testing.TestWamiContextFactory}.
 */
public final class WamiContext {

    private final TenantPath tenantPath;
    private final String instanceId;
    private final WamiArn callerArn;
    private final boolean root;
    private final String region;
    private final SessionInfo sessionInfo;

    private WamiContext(Builder builder) {
        this.tenantPath = builder.tenantPath;
        this.instanceId = builder.instanceId;
        this.callerArn = builder.callerArn;
        this.root = builder.root;
        this.region = builder.region;
        this.sessionInfo = builder.sessionInfo;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The tenant the caller is scoped to. */
    public TenantPath tenantPath() {
        return tenantPath;
    }

    public String instanceId() {
        return instanceId;
    }

    public WamiArn callerArn() {
        return callerArn;
    }

    /** Root callers bypass policy evaluation and tenant scoping. */
    public boolean isRoot() {
        return root;
    }

    public Optional<String> region() {
        return Optional.ofNullable(region);
    }

    public Optional<SessionInfo> sessionInfo() {
        return Optional.ofNullable(sessionInfo);
    }

    /** Role assumed by the current session, if any. */
    public Optional<WamiArn> assumedRoleArn() {
        return sessionInfo().flatMap(SessionInfo::assumedRoleArnOptional);
    }

    /**
     * True when the caller may reach {@code target}: root callers reach every tenant, everyone else
     * only their own tenant and its descendants.
     */
    public boolean canAccessTenant(TenantPath target) {
        return root || target.startsWith(tenantPath);
    }

    /** True when the caller may reach the tenant that owns {@code resource}. */
    public boolean canAccessResource(WamiArn resource) {
        return canAccessTenant(resource.tenantPath());
    }

    /** True when the session has expired. Contexts without a session never expire. */
    public boolean isExpired() {
        return isExpired(Instant.now(Clock.systemUTC()));
    }

    public boolean isExpired(Instant now) {
        return sessionInfo != null && sessionInfo.isExpiredAt(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WamiContext other)) {
            return false;
        }
        return root == other.root
                && tenantPath.equals(other.tenantPath)
                && instanceId.equals(other.instanceId)
                && callerArn.equals(other.callerArn)
                && Objects.equals(region, other.region)
                && Objects.equals(sessionInfo, other.sessionInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantPath, instanceId, callerArn, root, region, sessionInfo);
    }

    @Override
    public String toString() {
        return "WamiContext[caller=%s, tenant=%s, instance=%s, root=%s]"
                .formatted(callerArn, tenantPath, instanceId, root);
    }

    /** Fluent builder; {@link #build()} validates required fields. */
    public static final class Builder {

        private TenantPath tenantPath;
        private String instanceId;
        private WamiArn callerArn;
        private boolean root;
        private String region;
        private SessionInfo sessionInfo;

        private Builder() {
        }

        public Builder tenantPath(TenantPath tenantPath) {
            this.tenantPath = tenantPath;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder callerArn(WamiArn callerArn) {
            this.callerArn = callerArn;
            return this;
        }

        public Builder root(boolean root) {
            this.root = root;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder sessionInfo(SessionInfo sessionInfo) {
            this.sessionInfo = sessionInfo;
            return this;
        }

        /**
         * @throws InvalidParameterException if the tenant path, instance id or caller ARN is
         *                                   missing, or the instance id is blank
         */
        public WamiContext build() {
            if (tenantPath == null) {
                throw new InvalidParameterException("tenantPath is required");
            }
            if (instanceId == null) {
                throw new InvalidParameterException("instanceId is required");
            }
            if (callerArn == null) {
                throw new InvalidParameterException("callerArn is required");
            }
            if (instanceId.isBlank()) {
                throw new InvalidParameterException("instanceId cannot be empty");
            }
            return new WamiContext(this);
        }
    }
}
