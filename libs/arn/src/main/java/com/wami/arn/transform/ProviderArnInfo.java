package com.wami.arn.transform;

import com.wami.arn.ArnBuilder;
import com.wami.arn.CloudMapping;
import com.wami.arn.Service;
import com.wami.arn.TenantPath;
import com.wami.arn.WamiArn;

import java.util.Optional;

/**
 * What a provider-native identifier carries.
 *
 * <p>Provider formats have no notion of a tenant path or a WAMI instance, so neither appears
 * here. {@link #toWamiArn(Service, TenantPath, String)} takes them from the caller.
 *
 * @param provider     provider name (e.g., "aws")
 * @param accountId    account, project or subscription
 * @param service      provider-side service token or namespace
 * @param resourceType resource kind
 * @param resourceId   resource identifier
 * @param region       region, or {@code null} when the format has none
 */
public record ProviderArnInfo(
        String provider,
        String accountId,
        String service,
        String resourceType,
        String resourceId,
        String region) {

    public Optional<String> regionOptional() {
        return Optional.ofNullable(region);
    }

    /** The cloud mapping this identifier implies. */
    public CloudMapping cloudMapping() {
        return new CloudMapping(provider, accountId, region);
    }

    /**
     * Rebuilds a cloud-synced WAMI ARN from this identifier and the context the provider format
     * cannot carry.
     */
    public WamiArn toWamiArn(Service wamiService, TenantPath tenantPath, String wamiInstanceId) {
        ArnBuilder builder = WamiArn.builder()
                .service(wamiService)
                .tenantPath(tenantPath)
                .wamiInstance(wamiInstanceId)
                .cloudMapping(cloudMapping())
                .resource(resourceType, resourceId);
        return builder.build();
    }
}
