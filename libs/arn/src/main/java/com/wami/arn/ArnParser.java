package com.wami.arn;

import java.util.Arrays;

/**
 * Strict decoder and encoder for the canonical WAMI ARN string.
 *
 * <pre>
 * native:         arn:wami:&lt;service&gt;:&lt;seg&gt;[/&lt;seg&gt;...]:wami:&lt;instance&gt;:&lt;type&gt;/&lt;id&gt;
 * cloud (region): arn:wami:&lt;service&gt;:&lt;seg&gt;...:wami:&lt;instance&gt;:&lt;provider&gt;:&lt;account&gt;:&lt;region|global&gt;:&lt;type&gt;/&lt;id&gt;
 * cloud (legacy): arn:wami:&lt;service&gt;:&lt;seg&gt;...:wami:&lt;instance&gt;:&lt;provider&gt;:&lt;account&gt;:&lt;type&gt;/&lt;id&gt;
 * </pre>
 *
 * <p>The legacy form is accepted on input only; cloud-synced ARNs are always written in the
 * region form. Which form a string uses is decided by {@link #classifyLayout(String[])} from the
 * segment count alone.
 */
public final class ArnParser {

    static final String ARN = "arn";
    static final String WAMI = "wami";

    private static final int MIN_SEGMENTS = 7;
    private static final int REGIONAL_MIN_SEGMENTS = 10;
    private static final int LEGACY_SEGMENTS = 9;
    private static final int FIRST_TAIL_SEGMENT = 6;

    /** How the segments after the instance id are laid out. */
    public enum Layout {
        /** {@code provider:account:region:type/id}. */
        CLOUD_REGIONAL,
        /** {@code provider:account:type/id}. */
        CLOUD_LEGACY,
        /** {@code type/id}, where the id may itself contain {@code :}. */
        NATIVE
    }

    private ArnParser() {
        // utility class
    }

    /**
     * Parses a canonical ARN string.
     *
     * @throws ArnParseException if the string is malformed
     */
    public static WamiArn parse(String arn) {
        if (arn == null) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_FORMAT, "ARN must not be null");
        }
        String[] parts = arn.split(":", -1);

        if (parts.length < MIN_SEGMENTS) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_FORMAT,
                    "Expected at least %d parts, got %d".formatted(MIN_SEGMENTS, parts.length));
        }
        if (!ARN.equals(parts[0])) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_FORMAT,
                    "Expected 'arn' prefix, got '%s'".formatted(parts[0]));
        }
        if (!WAMI.equals(parts[1])) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_FORMAT,
                    "Expected 'wami' namespace, got '%s'".formatted(parts[1]));
        }
        if (parts[2].isEmpty()) {
            throw new ArnParseException(ArnParseException.Kind.MISSING_COMPONENT, "Service cannot be empty");
        }
        Service service = Service.of(parts[2]);
        TenantPath tenantPath = TenantPath.parse(parts[3]);

        if (!WAMI.equals(parts[4])) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_FORMAT,
                    "Expected 'wami' marker at position 4, got '%s'".formatted(parts[4]));
        }
        String instanceId = parts[5];
        if (instanceId.isEmpty()) {
            throw new ArnParseException(ArnParseException.Kind.MISSING_COMPONENT,
                    "WAMI instance ID cannot be empty");
        }

        CloudMapping cloudMapping;
        int resourceStart;
        switch (classifyLayout(parts)) {
            case CLOUD_REGIONAL -> {
                requireNonEmpty(parts[6], parts[7], parts[8]);
                cloudMapping = new CloudMapping(parts[6], parts[7], parts[8]);
                resourceStart = 9;
            }
            case CLOUD_LEGACY -> {
                requireNonEmpty(parts[6], parts[7]);
                cloudMapping = CloudMapping.of(parts[6], parts[7]);
                resourceStart = 8;
            }
            default -> {
                cloudMapping = null;
                resourceStart = FIRST_TAIL_SEGMENT;
            }
        }

        String resourceToken = String.join(":", Arrays.copyOfRange(parts, resourceStart, parts.length));
        return new WamiArn(service, tenantPath, instanceId, cloudMapping, parseResource(resourceToken));
    }

    /**
     * Decides the layout of the segments after the instance id.
     *
     * <ul>
     *   <li>10 or more segments and segments 6..8 free of {@code /}: {@link Layout#CLOUD_REGIONAL}
     *   <li>exactly 9 segments and segments 6..7 free of {@code /}: {@link Layout#CLOUD_LEGACY}
     *   <li>anything else: {@link Layout#NATIVE}
     * </ul>
     *
     * <p>A native resource always carries a {@code /} in segment 6 (its {@code type/} part), which
     * is what keeps a native ARN whose id contains colons from being read as cloud-synced.
     *
     * @param parts the ARN split on every {@code :}; must have at least 7 elements
     */
    public static Layout classifyLayout(String[] parts) {
        if (parts.length >= REGIONAL_MIN_SEGMENTS) {
            return slashFree(parts, 6, 9) ? Layout.CLOUD_REGIONAL : Layout.NATIVE;
        }
        if (parts.length == LEGACY_SEGMENTS) {
            return slashFree(parts, 6, 8) ? Layout.CLOUD_LEGACY : Layout.NATIVE;
        }
        return Layout.NATIVE;
    }

    /** Formats an ARN in canonical form. */
    public static String format(WamiArn arn) {
        return formatPrefix(arn) + ":" + arn.resource().asPath();
    }

    static String formatPrefix(WamiArn arn) {
        StringBuilder sb = new StringBuilder()
                .append(ARN).append(':')
                .append(WAMI).append(':')
                .append(arn.service().value()).append(':')
                .append(arn.tenantPath()).append(':')
                .append(WAMI).append(':')
                .append(arn.wamiInstanceId());
        CloudMapping mapping = arn.cloudMapping();
        if (mapping != null) {
            sb.append(':').append(mapping.provider())
                    .append(':').append(mapping.accountId())
                    .append(':').append(mapping.regionOrGlobal());
        }
        return sb.toString();
    }

    /**
     * Splits a {@code type/id} token on its first {@code /}.
     *
     * @throws ArnParseException if there is no {@code /} or either side is empty
     */
    static Resource parseResource(String token) {
        int slash = token.indexOf('/');
        if (slash < 0) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_FORMAT,
                    "Resource must be in format 'type/id', got '%s'".formatted(token));
        }
        String type = token.substring(0, slash);
        String id = token.substring(slash + 1);
        if (type.isEmpty() || id.isEmpty()) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_COMPONENT,
                    "Resource type and ID cannot be empty");
        }
        if (type.indexOf(':') >= 0) {
            throw new ArnParseException(ArnParseException.Kind.INVALID_COMPONENT,
                    "Resource type cannot contain ':', got '%s'".formatted(type));
        }
        return new Resource(type, id);
    }

    private static boolean slashFree(String[] parts, int from, int to) {
        for (int i = from; i < to; i++) {
            if (parts[i].indexOf('/') >= 0) {
                return false;
            }
        }
        return true;
    }

    private static void requireNonEmpty(String... fields) {
        for (String field : fields) {
            if (field.isEmpty()) {
                throw new ArnParseException(ArnParseException.Kind.INVALID_COMPONENT,
                        "Provider, account ID, and region cannot be empty");
            }
        }
    }
}
