package com.wami.policy.store;

import com.wami.arn.WamiArn;
import com.wami.common.InvalidParameterException;

/** Maps principal ARNs to the ids the {@link PolicyStore} is keyed by. */
public final class Principals {

    /** Resource type of a user ARN. */
    public static final String USER = "user";

    private Principals() {
        // utility class
    }

    /**
     * The user id carried by a user ARN ({@code ...:user/<id>}).
     *
     * @throws InvalidParameterException if the ARN does not name a user
     */
    public static String userId(WamiArn arn) {
        if (!USER.equals(arn.resourceType())) {
            throw new InvalidParameterException(
                    "Caller ARN is not a user ARN: %s".formatted(arn));
        }
        return arn.resourceId();
    }
}
