package com.wami.arn;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured, provider-neutral identifier of a resource managed by a WAMI instance.
 *
 * <p>WHY a record: ARNs are immutable values compared structurally. They are created by {@link
 * ArnBuilder} or {@link #parse(String)} and never modified in place; the {@code with*} methods
 * return new values. {@link #toString()} is the canonical serialization and the exact inverse of
 * {@link #parse(String)}.
 *
 * @param service        service namespace
 * @param tenantPath     owning tenant, root first
 * @param wamiInstanceId id of the WAMI instance that owns the resource
 * @param cloudMapping   provider mirror, or {@code null} for a WAMI-native resource
 * @param resource       resource type and id
 */
public record WamiArn(
        Service service,
        TenantPath tenantPath,
        String wamiInstanceId,
        CloudMapping cloudMapping,
        Resource resource) {

    public WamiArn {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(tenantPath, "tenantPath");
        Objects.requireNonNull(wamiInstanceId, "wamiInstanceId");
        Objects.requireNonNull(resource, "resource");
        ArnComponents.requireToken(service.value(), "service", ':');
        ArnComponents.requireToken(wamiInstanceId, "wami_instance_id", ':');
    }

    /** Starts a new fluent builder. */
    public static ArnBuilder builder() {
        return new ArnBuilder();
    }

    /**
     * Parses a canonical ARN string.
     *
     * @throws ArnParseException if the string is not a valid WAMI ARN
     */
    public static WamiArn parse(String arn) {
        return ArnParser.parse(arn);
    }

    /**
     * Everything before the resource: {@code arn:wami:<service>:<tenant>:wami:<instance>} followed by
     * {@code :<provider>:<account>:<region|global>} when cloud-synced.
     */
    public String prefix() {
        return ArnParser.formatPrefix(this);
    }

    public Optional<CloudMapping> cloudMappingOptional() {
        return Optional.ofNullable(cloudMapping);
    }

    public boolean isCloudSynced() {
        return cloudMapping != null;
    }

    /** Provider name of the cloud mapping, if any. */
    public Optional<String> provider() {
        return cloudMappingOptional().map(CloudMapping::provider);
    }

    /** Root tenant of the owning path. */
    public String primaryTenant() {
        return tenantPath.root();
    }

    /** Owning (deepest) tenant. */
    public String leafTenant() {
        return tenantPath.leaf();
    }

    public String fullTenantPath() {
        return tenantPath.toString();
    }

    public boolean matchesPrefix(String prefix) {
        return toString().startsWith(prefix);
    }

    /** True when the resource is owned by {@code path} or one of its descendants. */
    public boolean belongsToTenant(TenantPath path) {
        return tenantPath.startsWith(path);
    }

    public String resourceType() {
        return resource.resourceType();
    }

    public String resourceId() {
        return resource.resourceId();
    }

    /** Returns a copy mirrored to the given provider account. */
    public WamiArn withCloudMapping(CloudMapping mapping) {
        return new WamiArn(service, tenantPath, wamiInstanceId,
                Objects.requireNonNull(mapping, "mapping"), resource);
    }

    /** Returns a WAMI-native copy. */
    public WamiArn withoutCloudMapping() {
        return new WamiArn(service, tenantPath, wamiInstanceId, null, resource);
    }

    @Override
    public String toString() {
        return ArnParser.format(this);
    }
}
