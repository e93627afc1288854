package io.pagetree.core.spi;

import java.util.Optional;

/**
 * Storage collaborator: a key-value content store keyed by integer document id.
 *
 * <p>
 * The stored value is an encoded tree as produced by the document service (JSON text). The store
 * owns write atomicity: a failed {@link #save} must leave the previous version in place. No
 * locking or versioning is expected; concurrent writers race and the last write wins.
 *
 * <p>
 * Implementations MUST be thread-safe.
 */
public interface DocumentStore {

    /** Raw stored payload under the primary key, or empty when the document has none. */
    Optional<String> load(long documentId);

    /**
     * Raw stored payload under the legacy key, consulted when the primary key yields nothing.
     * Stores without a legacy key return empty.
     */
    default Optional<String> loadLegacy(long documentId) {
        return Optional.empty();
    }

    /**
     * Persists {@code payload} under the primary key.
     *
     * @return {@code true} when the write landed
     */
    boolean save(long documentId, String payload);
}
