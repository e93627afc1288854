package io.pagetree.core.error;

/** Thrown when a bundled classpath resource (element type catalog, canonical tree schema) cannot be loaded. */
public final class ResourceLoadException extends PageTreeException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "resource_load_failed";

    private final String source;

    public ResourceLoadException(String message, String source) {
        super(message, CODE);
        this.source = source;
    }

    public ResourceLoadException(String message, Throwable cause, String source) {
        super(message, cause, CODE);
        this.source = source;
    }

    /** The resource that failed to load. */
    public String source() {
        return source;
    }
}
