package com.wami.arn.transform;

import com.wami.arn.WamiArn;

/**
 * Codec between WAMI ARNs and one provider's native identifier format.
 *
 * <p>{@link #toProviderArn(WamiArn)} needs the ARN's cloud mapping to name this transformer's
 * provider. {@link #fromProviderArn(String)} is lossy: see {@link ProviderArnInfo}.
 */
public interface ArnTransformer {

    /** The provider this codec handles. */
    CloudProvider provider();

    /**
     * Renders the provider-native identifier of a cloud-synced ARN.
     *
     * @throws com.wami.common.InvalidParameterException if the ARN is not cloud-synced or is
     *     mapped to another provider
     */
    String toProviderArn(WamiArn arn);

    /**
     * Parses a provider-native identifier.
     *
     * @throws com.wami.common.InvalidParameterException if the identifier is malformed
     */
    ProviderArnInfo fromProviderArn(String providerArn);
}
