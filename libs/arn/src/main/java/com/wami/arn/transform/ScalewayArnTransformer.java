package com.wami.arn.transform;

import com.wami.arn.CloudMapping;
import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

import java.util.Arrays;

/** Scaleway identifiers: {@code scw:<organization>:<service>:<type>/<id>}. */
public final class ScalewayArnTransformer extends AbstractArnTransformer {

    public ScalewayArnTransformer() {
        super(CloudProvider.SCALEWAY);
    }

    @Override
    String render(WamiArn arn, CloudMapping mapping) {
        String service = switch (arn.service().kind()) {
            case SSO_ADMIN -> "sso";
            case CUSTOM -> arn.service().value();
            default -> "iam";
        };
        return "scw:%s:%s:%s".formatted(mapping.accountId(), service, arn.resource().asPath());
    }

    @Override
    public ProviderArnInfo fromProviderArn(String providerArn) {
        String[] parts = providerArn.split(":", -1);
        if (parts.length < 4) {
            throw new InvalidParameterException(
                    "Invalid Scaleway resource format: expected at least 4 parts, got %d".formatted(parts.length));
        }
        if (!"scw".equals(parts[0])) {
            throw new InvalidParameterException(
                    "Invalid Scaleway resource prefix: expected 'scw', got '%s'".formatted(parts[0]));
        }
        String resourcePart = String.join(":", Arrays.copyOfRange(parts, 3, parts.length));
        String[] resource = splitResource(resourcePart, "Scaleway");
        return new ProviderArnInfo("scaleway", parts[1], parts[2], resource[0], resource[1], null);
    }
}
