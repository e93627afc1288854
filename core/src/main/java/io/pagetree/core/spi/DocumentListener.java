package io.pagetree.core.spi;

import java.util.List;

/**
 * Observability hook for document writes.
 *
 * <p>
 * Events are immutable. Implementations MUST be thread-safe and non-blocking. Exceptions thrown by
 * listeners are caught by the document service and logged; they never affect the operation.
 */
public interface DocumentListener {

    /** Called after a tree was persisted and the cache invalidation was attempted. */
    void onDocumentSaved(DocumentSavedEvent event);

    /** Called when a write was refused (validation errors, schema violation, class rule, failed save). */
    void onDocumentRejected(DocumentRejectedEvent event);

    // --- Event records ---

    /** Event emitted after a successful save. */
    record DocumentSavedEvent(long documentId, String operation, int elementCount, int warningCount,
            boolean cacheInvalidated) {}

    /** Event emitted when a write is refused. */
    record DocumentRejectedEvent(long documentId, String operation, String reason, List<String> codes) {

        public DocumentRejectedEvent {
            codes = codes != null ? List.copyOf(codes) : List.of();
        }
    }
}
