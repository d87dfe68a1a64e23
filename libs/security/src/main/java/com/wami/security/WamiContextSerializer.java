package com.wami.security;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wami.arn.TenantPath;
import com.wami.arn.WamiArn;
import com.wami.common.WamiException;

import java.io.IOException;
import java.util.Base64;

/**
 * Serializes and deserializes {@link WamiContext} for service-to-service propagation.
 * <p>
 * WHY JSON + Base64: transport headers carry strings. ARNs and tenant paths travel in their
 * canonical string form and are parsed again on the receiving side, so a tampered or truncated
 * value fails instead of producing a context the builder would have rejected.
 */
public final class WamiContextSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WamiContextSerializer() {
        // utility class
    }

    /**
     * Serializes a context to a Base64-encoded JSON string.
     *
     * @throws ContextSerializationException if serialization fails
     */
    public static String serialize(WamiContext context) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(ContextPayload.from(context));
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new ContextSerializationException("Failed to serialize WAMI context", e);
        }
    }

    /**
     * Rebuilds a context from {@link #serialize} output.
     *
     * @throws ContextSerializationException if the input is not a valid encoded context
     */
    public static WamiContext deserialize(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new ContextSerializationException("Failed to deserialize WAMI context: empty input", null);
        }
        try {
            byte[] json = Base64.getDecoder().decode(encoded);
            return MAPPER.readValue(json, ContextPayload.class).toContext();
        } catch (IllegalArgumentException | IOException | WamiException e) {
            throw new ContextSerializationException("Failed to deserialize WAMI context", e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ContextPayload(
            String tenantPath,
            String instanceId,
            String callerArn,
            boolean root,
            String region,
            SessionPayload session) {

        static ContextPayload from(WamiContext context) {
            return new ContextPayload(
                    context.tenantPath().toString(),
                    context.instanceId(),
                    context.callerArn().toString(),
                    context.isRoot(),
                    context.region().orElse(null),
                    context.sessionInfo().map(SessionPayload::from).orElse(null));
        }

        WamiContext toContext() {
            return WamiContext.builder()
                    .tenantPath(tenantPath == null ? null : TenantPath.parse(tenantPath))
                    .instanceId(instanceId)
                    .callerArn(callerArn == null ? null : WamiArn.parse(callerArn))
                    .root(root)
                    .region(region)
                    .sessionInfo(session == null ? null : session.toSessionInfo())
                    .build();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SessionPayload(String sessionToken, long expiration, String assumedRoleArn) {

        static SessionPayload from(SessionInfo session) {
            return new SessionPayload(
                    session.sessionToken(),
                    session.expiration(),
                    session.assumedRoleArnOptional().map(WamiArn::toString).orElse(null));
        }

        SessionInfo toSessionInfo() {
            return new SessionInfo(
                    sessionToken,
                    expiration,
                    assumedRoleArn == null ? null : WamiArn.parse(assumedRoleArn));
        }
    }

    /** Thrown when a context cannot be serialized or deserialized. */
    public static class ContextSerializationException extends RuntimeException {
        public ContextSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
