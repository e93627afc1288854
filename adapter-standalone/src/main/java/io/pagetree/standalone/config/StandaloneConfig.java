package io.pagetree.standalone.config;

import io.pagetree.core.model.BuilderMode;
import io.pagetree.core.validate.CanonicalCheckMode;
import io.pagetree.core.validate.ValidationLimits;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Root configuration of the standalone command-line tool.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param builderMode    page builder owning the documents (storage key prefix)
 * @param storageDir     directory holding one sub-directory per document
 * @param cacheDir       directory holding generated CSS cache files
 * @param maxDepth       validator depth limit
 * @param maxElements    validator element-count limit
 * @param canonicalCheck strict refuses non-conforming saves, lenient logs them
 * @param logFormat      {@code json} or {@code text}
 * @param logLevel       root log level
 */
public record StandaloneConfig(
        BuilderMode builderMode,
        Path storageDir,
        Path cacheDir,
        int maxDepth,
        int maxElements,
        CanonicalCheckMode canonicalCheck,
        String logFormat,
        String logLevel) {

    public StandaloneConfig {
        Objects.requireNonNull(builderMode, "builderMode must not be null");
        Objects.requireNonNull(storageDir, "storageDir must not be null");
        Objects.requireNonNull(cacheDir, "cacheDir must not be null");
        Objects.requireNonNull(canonicalCheck, "canonicalCheck must not be null");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("validation.max-depth must be positive, got " + maxDepth);
        }
        if (maxElements <= 0) {
            throw new IllegalArgumentException("validation.max-elements must be positive, got " + maxElements);
        }
        if (!"json".equalsIgnoreCase(logFormat) && !"text".equalsIgnoreCase(logFormat)) {
            throw new IllegalArgumentException("logging.format must be 'json' or 'text', got '" + logFormat + "'");
        }
    }

    /** Validator limits derived from {@link #maxDepth} and {@link #maxElements}. */
    public ValidationLimits validationLimits() {
        return new ValidationLimits(maxDepth, maxElements);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link StandaloneConfig}, pre-populated with the documented defaults. */
    public static final class Builder {
        private BuilderMode builderMode = BuilderMode.OXYGEN;
        private Path storageDir = Path.of("./documents");
        private Path cacheDir = Path.of("./css-cache");
        private int maxDepth = ValidationLimits.DEFAULT.maxDepth();
        private int maxElements = ValidationLimits.DEFAULT.maxElements();
        private CanonicalCheckMode canonicalCheck = CanonicalCheckMode.LENIENT;
        private String logFormat = "text";
        private String logLevel = "INFO";

        Builder() {}

        public Builder builderMode(BuilderMode builderMode) {
            this.builderMode = builderMode;
            return this;
        }

        public Builder builderMode(String builderMode) {
            this.builderMode = BuilderMode.fromString(builderMode);
            return this;
        }

        public Builder storageDir(Path storageDir) {
            this.storageDir = storageDir;
            return this;
        }

        public Builder storageDir(String storageDir) {
            this.storageDir = Path.of(storageDir);
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder cacheDir(String cacheDir) {
            this.cacheDir = Path.of(cacheDir);
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxElements(int maxElements) {
            this.maxElements = maxElements;
            return this;
        }

        public Builder canonicalCheck(CanonicalCheckMode canonicalCheck) {
            this.canonicalCheck = canonicalCheck;
            return this;
        }

        public Builder canonicalCheck(String canonicalCheck) {
            this.canonicalCheck = CanonicalCheckMode.fromString(canonicalCheck);
            return this;
        }

        public Builder logFormat(String logFormat) {
            this.logFormat = logFormat;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public StandaloneConfig build() {
            return new StandaloneConfig(
                    builderMode, storageDir, cacheDir, maxDepth, maxElements, canonicalCheck, logFormat, logLevel);
        }
    }
}
