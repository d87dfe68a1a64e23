package com.wami.arn.transform;

import com.wami.arn.CloudMapping;
import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

import java.util.Arrays;

/**
 * Azure resource IDs:
 * {@code /subscriptions/<subscription>/resourceGroups/wami-resources/providers/<namespace>/<type>/<id>}.
 *
 * <p>WAMI resources always live in the {@value #RESOURCE_GROUP} resource group.
 */
public final class AzureArnTransformer extends AbstractArnTransformer {

    static final String RESOURCE_GROUP = "wami-resources";
    static final String DEFAULT_NAMESPACE = "Microsoft.Authorization";

    public AzureArnTransformer() {
        super(CloudProvider.AZURE);
    }

    @Override
    String render(WamiArn arn, CloudMapping mapping) {
        String namespace = switch (arn.service().kind()) {
            case SSO_ADMIN -> "Microsoft.AzureActiveDirectory";
            case CUSTOM -> arn.service().value();
            default -> DEFAULT_NAMESPACE;
        };
        return "/subscriptions/%s/resourceGroups/%s/providers/%s/%s/%s".formatted(
                mapping.accountId(), RESOURCE_GROUP, namespace, arn.resourceType(), arn.resourceId());
    }

    @Override
    public ProviderArnInfo fromProviderArn(String providerArn) {
        String[] parts = providerArn.split("/", -1);
        if (parts.length < 9 || !parts[0].isEmpty()) {
            throw new InvalidParameterException("Invalid Azure resource ID format");
        }
        if (!"subscriptions".equals(parts[1])) {
            throw new InvalidParameterException(
                    "Invalid Azure resource ID: expected 'subscriptions', got '%s'".formatted(parts[1]));
        }
        if (!"resourceGroups".equals(parts[3]) || !"providers".equals(parts[5])) {
            throw new InvalidParameterException(
                    "Invalid Azure resource ID: expected '/resourceGroups/<group>/providers/<namespace>'");
        }
        String resourceType = parts[7];
        String resourceId = String.join("/", Arrays.copyOfRange(parts, 8, parts.length));
        if (resourceType.isEmpty() || resourceId.isEmpty()) {
            throw new InvalidParameterException("Invalid Azure resource ID: empty resource type or id");
        }
        return new ProviderArnInfo("azure", parts[2], parts[6], resourceType, resourceId, null);
    }
}
