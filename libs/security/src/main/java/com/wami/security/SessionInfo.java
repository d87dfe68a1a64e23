package com.wami.security;

import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

import java.time.Instant;
import java.util.Optional;

/**
 * Temporary-credential session attached to a {@link WamiContext}.
 *
 * @param sessionToken    opaque session token
 * @param expiration      expiry as epoch seconds (UTC)
 * @param assumedRoleArn  role assumed for this session, or {@code null}
 */
public record SessionInfo(String sessionToken, long expiration, WamiArn assumedRoleArn) {

    public SessionInfo {
        if (sessionToken == null || sessionToken.isBlank()) {
            throw new InvalidParameterException("sessionToken must not be null or blank");
        }
    }

    /** A session without an assumed role. */
    public static SessionInfo of(String sessionToken, Instant expiration) {
        return new SessionInfo(sessionToken, expiration.getEpochSecond(), null);
    }

    public Optional<WamiArn> assumedRoleArnOptional() {
        return Optional.ofNullable(assumedRoleArn);
    }

    /** Expired once {@code now} reaches the expiration second. */
    public boolean isExpiredAt(Instant now) {
        return now.getEpochSecond() >= expiration;
    }
}
