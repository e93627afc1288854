package io.pagetree.core.error;

/** Thrown when a canonical tree cannot be serialized for storage. */
public final class TreeEncodeException extends PageTreeException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "tree_encode_failed";

    private final long documentId;

    public TreeEncodeException(String message, Throwable cause, long documentId) {
        super(message, cause, CODE);
        this.documentId = documentId;
    }

    public long documentId() {
        return documentId;
    }
}
