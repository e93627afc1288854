package io.pagetree.core.validate;

/**
 * How the document service treats a canonicalized tree that fails {@link CanonicalTreeSchema}.
 *
 * <ul>
 * <li>{@link #STRICT}: refuse to save it ({@code canonical_schema_violation}).</li>
 * <li>{@link #LENIENT}: log a warning and save anyway (default).</li>
 * </ul>
 */
public enum CanonicalCheckMode {
    /** Refuse to persist a non-conforming tree. */
    STRICT,

    /** Log and persist (default). */
    LENIENT;

    /** Parses {@code strict} / {@code lenient} case-insensitively. */
    public static CanonicalCheckMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("canonical check mode must not be null");
        }
        for (CanonicalCheckMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "Unknown canonical check mode '" + value + "': expected 'strict' or 'lenient'");
    }
}
