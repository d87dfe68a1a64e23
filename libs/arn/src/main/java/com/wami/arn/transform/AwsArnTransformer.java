package com.wami.arn.transform;

import com.wami.arn.CloudMapping;
import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

import java.util.Arrays;

/**
 * AWS ARNs: {@code arn:aws:<service>:<region>:<account>:<type>/<id>}.
 *
 * <p>The region is empty for global resources (IAM users, for instance).
 */
public final class AwsArnTransformer extends AbstractArnTransformer {

    public AwsArnTransformer() {
        super(CloudProvider.AWS);
    }

    @Override
    String render(WamiArn arn, CloudMapping mapping) {
        String service = switch (arn.service().kind()) {
            case IAM -> "iam";
            case STS -> "sts";
            case SSO_ADMIN -> "sso";
            case CUSTOM -> arn.service().value();
        };
        String region = mapping.region() != null ? mapping.region() : "";
        return "arn:aws:%s:%s:%s:%s".formatted(service, region, mapping.accountId(), arn.resource().asPath());
    }

    @Override
    public ProviderArnInfo fromProviderArn(String providerArn) {
        String[] parts = providerArn.split(":", -1);
        if (parts.length < 6) {
            throw new InvalidParameterException(
                    "Invalid AWS ARN format: expected at least 6 parts, got %d".formatted(parts.length));
        }
        if (!"arn".equals(parts[0]) || !"aws".equals(parts[1])) {
            throw new InvalidParameterException("Invalid AWS ARN prefix: expected 'arn:aws', got '%s:%s'"
                    .formatted(parts[0], parts[1]));
        }
        String resourcePart = String.join(":", Arrays.copyOfRange(parts, 5, parts.length));
        String[] resource = splitResource(resourcePart, "AWS ARN");
        String region = parts[3].isEmpty() ? null : parts[3];
        return new ProviderArnInfo("aws", parts[4], parts[2], resource[0], resource[1], region);
    }
}
