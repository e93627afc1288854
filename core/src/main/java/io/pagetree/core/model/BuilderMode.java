package io.pagetree.core.model;

import java.util.Locale;

/**
 * Which page builder owns the stored documents. Determines the storage key prefix and the display
 * name; passed explicitly to every component that needs it.
 */
public enum BuilderMode {
    OXYGEN("_oxygen_", "Oxygen"),
    BREAKDANCE("_breakdance_", "Breakdance");

    private final String metaPrefix;
    private final String builderName;

    BuilderMode(String metaPrefix, String builderName) {
        this.metaPrefix = metaPrefix;
        this.builderName = builderName;
    }

    /** Prefix of per-document storage keys, e.g. {@code _oxygen_} for {@code _oxygen_data}. */
    public String metaPrefix() {
        return metaPrefix;
    }

    /** Storage key of the primary document tree. */
    public String dataKey() {
        return metaPrefix + "data";
    }

    public String builderName() {
        return builderName;
    }

    /**
     * Parses a mode name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static BuilderMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("builder mode must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown builder mode '" + value + "': expected one of: oxygen, breakdance", e);
        }
    }
}
