package com.wami.arn.transform;

import com.wami.arn.WamiArn;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of provider codecs, keyed by provider name.
 *
 * <p>An unknown provider name yields an empty result rather than an error: having no codec is
 * not a failure of the lookup.
 */
public final class ArnTransformers {

    private static final Map<CloudProvider, ArnTransformer> TRANSFORMERS = createTransformers();

    private ArnTransformers() {
        // utility class
    }

    private static Map<CloudProvider, ArnTransformer> createTransformers() {
        Map<CloudProvider, ArnTransformer> map = new EnumMap<>(CloudProvider.class);
        map.put(CloudProvider.AWS, new AwsArnTransformer());
        map.put(CloudProvider.GCP, new GcpArnTransformer());
        map.put(CloudProvider.AZURE, new AzureArnTransformer());
        map.put(CloudProvider.SCALEWAY, new ScalewayArnTransformer());
        return map;
    }

    /** The codec for a provider name such as "aws", or empty if there is none. */
    public static Optional<ArnTransformer> forProvider(String providerName) {
        return CloudProvider.fromString(providerName).map(TRANSFORMERS::get);
    }

    public static ArnTransformer forProvider(CloudProvider provider) {
        return TRANSFORMERS.get(provider);
    }

    /**
     * Renders an ARN in the native format of the provider it is mapped to.
     *
     * @return the native identifier, or empty if the ARN is WAMI-native or its provider has no codec
     */
    public static Optional<String> toProviderArn(WamiArn arn) {
        return arn.provider()
                .flatMap(ArnTransformers::forProvider)
                .map(transformer -> transformer.toProviderArn(arn));
    }
}
