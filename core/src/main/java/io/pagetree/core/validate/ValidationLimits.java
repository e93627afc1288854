package io.pagetree.core.validate;

/**
 * Structural limits enforced by {@link TreeValidator}.
 *
 * @param maxDepth    deepest element nesting accepted (direct children of the root are depth 1)
 * @param maxElements most elements accepted in one tree
 */
public record ValidationLimits(int maxDepth, int maxElements) {

    /** Default limits: 50 levels, 10000 elements. */
    public static final ValidationLimits DEFAULT = new ValidationLimits(50, 10_000);

    public ValidationLimits {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxElements <= 0) {
            throw new IllegalArgumentException("maxElements must be positive, got: " + maxElements);
        }
    }
}
