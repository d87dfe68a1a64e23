package com.wami.arn;

import com.wami.common.InvalidParameterException;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent, validating constructor for {@link WamiArn}.
 *
 * <p>Setters only accumulate; {@link #build()} checks every field and fails with {@link
 * InvalidParameterException} naming the first missing or invalid one. Components that would make
 * the canonical string ambiguous (a {@code :} inside a field, a {@code /} inside a cloud field or
 * resource type) are rejected, so every built ARN survives a format/parse round trip. Resource and
 * cloud fields are checked by {@link Resource} and {@link CloudMapping} as soon as they are set.
 */
public final class ArnBuilder {

    private Service service;
    private List<Long> tenantSegments;
    private String wamiInstanceId;
    private CloudMapping cloudMapping;
    private Resource resource;

    ArnBuilder() {
    }

    public ArnBuilder service(Service service) {
        this.service = service;
        return this;
    }

    /** Sets the service from its ARN token; unknown tokens become custom services. */
    public ArnBuilder service(String token) {
        this.service = token == null ? null : Service.of(token);
        return this;
    }

    public ArnBuilder tenantPath(TenantPath path) {
        this.tenantSegments = path == null ? null : path.segments();
        return this;
    }

    /** Sets a single-level tenant path. */
    public ArnBuilder tenant(long tenantId) {
        this.tenantSegments = List.of(tenantId);
        return this;
    }

    /** Sets the tenant path from root-first hierarchy segments. */
    public ArnBuilder tenantHierarchy(List<Long> segments) {
        this.tenantSegments = segments == null ? null : new ArrayList<>(segments);
        return this;
    }

    public ArnBuilder tenantHierarchy(long... segments) {
        List<Long> list = new ArrayList<>(segments.length);
        for (long segment : segments) {
            list.add(segment);
        }
        this.tenantSegments = list;
        return this;
    }

    public ArnBuilder wamiInstance(String instanceId) {
        this.wamiInstanceId = instanceId;
        return this;
    }

    /** Maps the resource to a global (region-less) provider account. */
    public ArnBuilder cloudProvider(String provider, String accountId) {
        this.cloudMapping = CloudMapping.of(provider, accountId);
        return this;
    }

    public ArnBuilder cloudProviderWithRegion(String provider, String accountId, String region) {
        this.cloudMapping = CloudMapping.withRegion(provider, accountId, region);
        return this;
    }

    /** Sets the region of an already configured cloud mapping; ignored when there is none. */
    public ArnBuilder region(String region) {
        if (cloudMapping != null) {
            this.cloudMapping = new CloudMapping(cloudMapping.provider(), cloudMapping.accountId(), region);
        }
        return this;
    }

    public ArnBuilder cloudMapping(CloudMapping mapping) {
        this.cloudMapping = mapping;
        return this;
    }

    public ArnBuilder noCloudMapping() {
        this.cloudMapping = null;
        return this;
    }

    public ArnBuilder resource(String resourceType, String resourceId) {
        this.resource = new Resource(resourceType, resourceId);
        return this;
    }

    public ArnBuilder resource(Resource resource) {
        this.resource = resource;
        return this;
    }

    /**
     * Validates the accumulated fields and creates the ARN.
     *
     * @throws InvalidParameterException naming the missing or invalid field
     */
    public WamiArn build() {
        if (service == null) {
            throw invalid("service is required");
        }
        if (tenantSegments == null) {
            throw invalid("tenant_path is required");
        }
        if (wamiInstanceId == null) {
            throw invalid("wami_instance_id is required");
        }
        if (resource == null) {
            throw invalid("resource is required");
        }
        if (tenantSegments.isEmpty()) {
            throw invalid("tenant_path cannot be empty");
        }
        for (Long segment : tenantSegments) {
            if (segment == null) {
                throw invalid("tenant_path cannot contain null segments");
            }
        }
        if (service.value().isEmpty()) {
            throw invalid("service cannot be empty");
        }
        if (wamiInstanceId.isEmpty()) {
            throw invalid("wami_instance_id cannot be empty");
        }
        requireNo(service.value(), ":", "service");
        requireNo(wamiInstanceId, ":", "wami_instance_id");

        return new WamiArn(service, new TenantPath(tenantSegments), wamiInstanceId, cloudMapping, resource);
    }

    private static void requireNo(String value, String forbidden, String field) {
        if (value.contains(forbidden)) {
            throw invalid("%s cannot contain '%s'".formatted(field, forbidden));
        }
    }

    private static InvalidParameterException invalid(String message) {
        return new InvalidParameterException("ARN builder: " + message);
    }
}
