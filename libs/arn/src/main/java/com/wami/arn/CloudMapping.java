package com.wami.arn;

import java.util.Objects;
import java.util.Optional;

/**
 * Link between a WAMI resource and its mirror in a cloud provider account.
 *
 * <p>Every field is non-empty and free of {@code :} and {@code /}, the ARN separators.
 *
 * @param provider  provider name (e.g., "aws", "gcp")
 * @param accountId provider account, project or subscription
 * @param region    provider region, or {@code null} for a global resource
 */
public record CloudMapping(String provider, String accountId, String region) {

    /** Token written in place of an absent region. */
    public static final String GLOBAL = "global";

    public CloudMapping {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(accountId, "accountId");
        // "global" is the serialized form of an absent region
        if (GLOBAL.equals(region)) {
            region = null;
        }
        ArnComponents.requireToken(provider, "provider", ':', '/');
        ArnComponents.requireToken(accountId, "account_id", ':', '/');
        if (region != null) {
            ArnComponents.requireToken(region, "region", ':', '/');
        }
    }

    /** Creates a global (region-less) mapping. */
    public static CloudMapping of(String provider, String accountId) {
        return new CloudMapping(provider, accountId, null);
    }

    /** Creates a regional mapping. */
    public static CloudMapping withRegion(String provider, String accountId, String region) {
        return new CloudMapping(provider, accountId, Objects.requireNonNull(region, "region"));
    }

    public Optional<String> regionOptional() {
        return Optional.ofNullable(region);
    }

    public boolean isRegional() {
        return region != null;
    }

    /** The region, or {@value #GLOBAL} when absent. */
    public String regionOrGlobal() {
        return region != null ? region : GLOBAL;
    }
}
