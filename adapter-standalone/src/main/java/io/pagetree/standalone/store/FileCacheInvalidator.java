package io.pagetree.standalone.store;

import io.pagetree.core.spi.CacheInvalidator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CacheInvalidator} that deletes the generated stylesheet {@code post-<id>.css} and its
 * {@code post-<id>.json} sidecar from the cache directory. A missing cache file is not a failure;
 * the renderer regenerates on demand.
 */
public final class FileCacheInvalidator implements CacheInvalidator {

    private static final Logger LOG = LoggerFactory.getLogger(FileCacheInvalidator.class);

    private final Path cacheDir;

    public FileCacheInvalidator(Path cacheDir) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir must not be null");
    }

    static String cssFileName(long documentId) {
        return "post-" + documentId + ".css";
    }

    static String sidecarFileName(long documentId) {
        return "post-" + documentId + ".json";
    }

    /** @return {@code false} when the cache directory is unusable or a file cannot be deleted */
    @Override
    public boolean invalidate(long documentId) {
        if (Files.exists(cacheDir) && !Files.isDirectory(cacheDir)) {
            LOG.warn("cache.not_a_directory dir={}", cacheDir);
            return false;
        }
        try {
            boolean css = Files.deleteIfExists(cacheDir.resolve(cssFileName(documentId)));
            boolean sidecar = Files.deleteIfExists(cacheDir.resolve(sidecarFileName(documentId)));
            LOG.debug("cache.invalidated document_id={} css_deleted={} sidecar_deleted={}", documentId, css, sidecar);
            return true;
        } catch (IOException e) {
            LOG.warn("cache.invalidation_failed document_id={} dir={}", documentId, cacheDir, e);
            return false;
        }
    }
}
