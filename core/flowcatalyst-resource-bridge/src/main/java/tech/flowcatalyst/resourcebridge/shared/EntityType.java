package tech.flowcatalyst.resourcebridge.shared;

/**
 * Entity types owned by the bridge with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix:
 * - Format: "{prefix}_{tsid}" (e.g., "crd_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.CREDENTIAL);  // "crd_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Authentication
    CREDENTIAL("crd"),
    PERMISSION_GROUP("pgr"),

    // Audit
    AUDIT_LOG("aud");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
