package io.pagetree.standalone.store;

import io.pagetree.core.model.BuilderMode;
import io.pagetree.core.spi.DocumentStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentStore} over a directory tree: {@code <root>/<documentId>/<metaPrefix>data.json}
 * holds the primary payload and {@code ct_builder_json.json} the legacy one.
 *
 * <p>
 * Writes go to a temporary file in the document directory and are then moved over the target, so
 * a failed write leaves the previous version readable. Thread-safe: no mutable state beyond the
 * file system.
 */
public final class FileDocumentStore implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileDocumentStore.class);

    static final String LEGACY_FILE = "ct_builder_json.json";

    private final Path root;
    private final String primaryFile;

    public FileDocumentStore(Path root, BuilderMode builderMode) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.primaryFile = Objects.requireNonNull(builderMode, "builderMode must not be null").dataKey() + ".json";
    }

    /** File holding the primary payload of {@code documentId}. */
    public Path primaryPath(long documentId) {
        return documentDir(documentId).resolve(primaryFile);
    }

    /** File holding the legacy payload of {@code documentId}. */
    public Path legacyPath(long documentId) {
        return documentDir(documentId).resolve(LEGACY_FILE);
    }

    @Override
    public Optional<String> load(long documentId) {
        return read(primaryPath(documentId));
    }

    @Override
    public Optional<String> loadLegacy(long documentId) {
        return read(legacyPath(documentId));
    }

    @Override
    public boolean save(long documentId, String payload) {
        Path target = primaryPath(documentId);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), primaryFile, ".tmp");
            Files.writeString(temp, payload, StandardCharsets.UTF_8);
            move(temp, target);
            LOG.debug("store.saved document_id={} file={} bytes={}", documentId, target, payload.length());
            return true;
        } catch (IOException e) {
            LOG.warn("store.save_failed document_id={} file={}", documentId, target, e);
            deleteQuietly(temp);
            return false;
        }
    }

    private Path documentDir(long documentId) {
        return root.resolve(Long.toString(documentId));
    }

    private static Optional<String> read(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return content.isBlank() ? Optional.empty() : Optional.of(content);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("store.read_failed file={}", file, e);
            return Optional.empty();
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("store.atomic_move_unsupported file={}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.debug("store.temp_cleanup_failed file={}", temp, e);
        }
    }
}
