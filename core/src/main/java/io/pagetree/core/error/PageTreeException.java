package io.pagetree.core.error;

/**
 * Abstract base for all page-tree exceptions. Never thrown directly. Validation findings are not
 * exceptions; these cover rule violations of mutating operations and infrastructure failures.
 */
public abstract class PageTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String code;

    protected PageTreeException(String message, String code) {
        super(message);
        this.code = code;
    }

    protected PageTreeException(String message, Throwable cause, String code) {
        super(message, cause);
        this.code = code;
    }

    /** Machine-readable error code, e.g. {@code builtin_class}. */
    public String code() {
        return code;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
