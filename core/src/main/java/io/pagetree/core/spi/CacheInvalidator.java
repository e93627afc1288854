package io.pagetree.core.spi;

/**
 * Tells the rendering side that the generated CSS of a document is stale. Called after every
 * successful save. Fire-and-observe: the result is logged, never retried.
 */
@FunctionalInterface
public interface CacheInvalidator {

    /** @return {@code true} when the invalidation was accepted */
    boolean invalidate(long documentId);

    /** An invalidator that accepts every call and does nothing. */
    static CacheInvalidator noop() {
        return documentId -> true;
    }
}
