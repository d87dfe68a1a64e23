package com.wami.arn.transform;

import com.wami.arn.CloudMapping;
import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

import java.util.Arrays;

/**
 * GCP full resource names: {@code //<service>.googleapis.com/projects/<project>/<type>s/<id>}.
 *
 * <p>The resource type is pluralized on the way out and singularized on the way in. GCP names
 * carry no region.
 */
public final class GcpArnTransformer extends AbstractArnTransformer {

    public GcpArnTransformer() {
        super(CloudProvider.GCP);
    }

    @Override
    String render(WamiArn arn, CloudMapping mapping) {
        String service = switch (arn.service().kind()) {
            case IAM, STS -> "iam.googleapis.com";
            case SSO_ADMIN -> "cloudidentity.googleapis.com";
            case CUSTOM -> arn.service().value();
        };
        return "//%s/projects/%s/%ss/%s".formatted(
                service, mapping.accountId(), arn.resourceType(), arn.resourceId());
    }

    @Override
    public ProviderArnInfo fromProviderArn(String providerArn) {
        if (!providerArn.startsWith("//")) {
            throw new InvalidParameterException("Invalid GCP resource name: expected '//' prefix");
        }
        String[] parts = providerArn.substring(2).split("/", -1);
        if (parts.length < 5) {
            throw new InvalidParameterException(
                    "Invalid GCP resource name format: expected at least 5 parts, got %d".formatted(parts.length));
        }
        if (!"projects".equals(parts[1])) {
            throw new InvalidParameterException(
                    "Invalid GCP resource name: expected 'projects', got '%s'".formatted(parts[1]));
        }
        String resourceType = parts[3];
        if (resourceType.endsWith("s")) {
            resourceType = resourceType.substring(0, resourceType.length() - 1);
        }
        String resourceId = String.join("/", Arrays.copyOfRange(parts, 4, parts.length));
        if (resourceType.isEmpty() || resourceId.isEmpty()) {
            throw new InvalidParameterException(
                    "Invalid GCP resource name: expected '<type>s/<id>' after the project");
        }
        return new ProviderArnInfo("gcp", parts[2], parts[0], resourceType, resourceId, null);
    }
}
