package tech.idplane.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 * TSID (Time-Sorted ID) provides:
 * - Time-sortable (creation order preserved)
 * - 64-bit efficiency (vs 128-bit UUID)
 * - Better index locality than random UUIDs
 *
 * IDs are stored and transmitted as typed IDs with 3-character prefixes.
 * Format: "{prefix}_{tsid}" (e.g., "rol_0HZXEQ5Y8JY5Z")
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    private TsidGenerator() {
    }

    /**
     * Generate a new typed ID for the given entity type.
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Generate a raw TSID without prefix.
     * Use this for non-entity IDs (execution IDs, event IDs).
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }
}
