package io.pagetree.core.error;

/** Thrown when a CSS class mutation breaks a class rule. */
public final class ClassOperationException extends PageTreeException {

    private static final long serialVersionUID = 1L;

    /** The class carries a built-in prefix and cannot be removed. */
    public static final String BUILTIN_CLASS = "builtin_class";

    /** The class is not among the element's custom classes. */
    public static final String CLASS_NOT_FOUND = "class_not_found";

    /** The name is not a valid CSS class name. */
    public static final String INVALID_CLASS_NAME = "invalid_class_name";

    private final String className;

    public ClassOperationException(String message, String code, String className) {
        super(message, code);
        this.className = className;
    }

    /** The class name the operation was attempted with. */
    public String className() {
        return className;
    }
}
