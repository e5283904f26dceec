package tech.idplane.platform.shared;

/**
 * Defines all entity types in the system with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix in the database:
 * - Format: "{prefix}_{tsid}" (e.g., "sac_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.SERVICE_ACCOUNT);  // "sac_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    SERVICE_ACCOUNT("sac"),
    USER("usr"),
    ROLE("rol"),
    SCOPE("scp"),
    AUDIT_LOG("aud");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
