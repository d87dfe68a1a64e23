package com.wami.arn.transform;

import java.util.Optional;

/**
 * Cloud providers with a native identifier codec.
 *
 * <p>WHY an enum: the provider set is small and fixed, so transformers are selected from a closed
 * list rather than discovered at runtime.
 */
public enum CloudProvider {

    AWS("aws"),
    GCP("gcp"),
    AZURE("azure"),
    SCALEWAY("scaleway");

    private final String value;

    CloudProvider(String value) {
        this.value = value;
    }

    /** The provider name used in cloud mappings (e.g., "aws"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a provider by its cloud-mapping name.
     *
     * @return the matching provider, or empty if the name is unknown
     */
    public static Optional<CloudProvider> fromString(String value) {
        for (CloudProvider provider : values()) {
            if (provider.value.equals(value)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
