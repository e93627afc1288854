package io.pagetree.core.spi;

import java.util.List;
import java.util.Optional;

/**
 * Closed list of element type tags the page builder recognizes, each under one of a fixed set of
 * namespace prefixes. Consulted only by the validator, for membership and for suggestions.
 *
 * <p>
 * Implementations MUST be immutable and thread-safe.
 */
public interface TypeVocabulary {

    /** Accepted namespace prefixes including the trailing backslash (e.g. {@code EssentialElements\}). */
    List<String> namespaces();

    /** All known fully qualified type tags, in a stable order. */
    List<String> types();

    /** {@code true} if {@code type} is a known fully qualified tag (exact, case-sensitive). */
    boolean isKnown(String type);

    /**
     * Resolves an unprefixed name to a known tag by exact case-insensitive match against aliases
     * and short names ({@code "heading"} → {@code EssentialElements\Heading}).
     */
    Optional<String> resolveShortName(String name);

    /** {@code true} if {@code type} starts with one of the accepted namespaces. */
    default boolean hasKnownNamespace(String type) {
        return namespaces().stream().anyMatch(type::startsWith);
    }

    /** The part of {@code type} after its namespace, or {@code type} itself when unprefixed. */
    default String shortName(String type) {
        for (String namespace : namespaces()) {
            if (type.startsWith(namespace)) {
                return type.substring(namespace.length());
            }
        }
        return type;
    }
}
