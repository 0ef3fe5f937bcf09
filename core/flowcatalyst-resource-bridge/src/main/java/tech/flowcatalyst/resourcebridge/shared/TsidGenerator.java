package tech.flowcatalyst.resourcebridge.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for bridge-owned entities.
 *
 * TSIDs are time-sortable 64-bit identifiers, rendered as 13 Crockford
 * base32 characters. Entity IDs carry a type prefix, for example
 * "aud_0HZXEQ5Y8JY5Z".
 */
public class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new typed ID for the given entity type.
     *
     * @param type the entity type
     * @return the typed ID (e.g., "crd_0HZXEQ5Y8JY5Z")
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Generate a raw TSID without prefix, for non-entity IDs such as execution IDs.
     *
     * @return the raw TSID (e.g., "0HZXEQ5Y8JY5Z")
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}
