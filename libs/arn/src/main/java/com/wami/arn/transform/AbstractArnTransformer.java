package com.wami.arn.transform;

import com.wami.arn.CloudMapping;
import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

/** Shared cloud-mapping checks and {@code type/id} splitting for provider codecs. */
abstract class AbstractArnTransformer implements ArnTransformer {

    private final CloudProvider provider;

    AbstractArnTransformer(CloudProvider provider) {
        this.provider = provider;
    }

    @Override
    public CloudProvider provider() {
        return provider;
    }

    @Override
    public final String toProviderArn(WamiArn arn) {
        CloudMapping mapping = arn.cloudMapping();
        if (mapping == null) {
            throw new InvalidParameterException("ARN is not cloud-synced");
        }
        if (!provider.value().equals(mapping.provider())) {
            throw new InvalidParameterException("ARN provider is '%s', expected '%s'"
                    .formatted(mapping.provider(), provider.value()));
        }
        return render(arn, mapping);
    }

    /** Renders the native identifier of an ARN already known to map to this provider. */
    abstract String render(WamiArn arn, CloudMapping mapping);

    /**
     * Splits {@code type/id} on the first {@code /}. Both halves must be non-empty.
     *
     * @return {@code [type, id]}
     */
    String[] splitResource(String resourcePart, String formatName) {
        int slash = resourcePart.indexOf('/');
        if (slash < 0) {
            throw new InvalidParameterException("Invalid %s resource format: expected 'type/id', got '%s'"
                    .formatted(formatName, resourcePart));
        }
        String type = resourcePart.substring(0, slash);
        String id = resourcePart.substring(slash + 1);
        if (type.isEmpty() || id.isEmpty()) {
            throw new InvalidParameterException("Invalid %s resource format: type and id cannot be empty, got '%s'"
                    .formatted(formatName, resourcePart));
        }
        return new String[] {type, id};
    }
}
