package com.libragraph.artifacts.core.cache;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Set;

/**
 * Populates one cache object through a temporary file and an atomic rename.
 *
 * <p>Cache objects are write-once and whole: only fresh/overwrite options are accepted.
 */
public class CacheOpener {

    private static final Set<StandardOpenOption> ALLOWED = EnumSet.of(
            StandardOpenOption.WRITE,
            StandardOpenOption.CREATE,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.SYNC,
            StandardOpenOption.DSYNC);

    /**
     * Writes content to an output stream.
     */
    @FunctionalInterface
    public interface ContentWriter {
        void write(OutputStream out) throws IOException;
    }

    private final Path target;

    CacheOpener(Path target) {
        this.target = target;
    }

    public Path target() {
        return target;
    }

    /**
     * Starts a write into a new temporary file beside the target.
     *
     * @throws CacheModeException if an append-like or read option is requested
     */
    public CacheWrite open(OpenOption... options) throws IOException {
        for (OpenOption option : options) {
            if (!(option instanceof StandardOpenOption) || !ALLOWED.contains(option)) {
                throw new CacheModeException(
                        "Cache objects are written whole; unsupported open option: " + option);
            }
        }
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tempFile = Files.createTempFile(dir, ObjectCache.TMP_PREFIX, null);
        try {
            return new CacheWrite(target, tempFile);
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /**
     * Runs the writer and commits on success; on any failure the temporary file is removed.
     */
    public Path write(ContentWriter writer) throws IOException {
        try (CacheWrite write = open()) {
            writer.write(write.outputStream());
            return write.commit();
        }
    }

    public Path copyFrom(Path source) throws IOException {
        return write(out -> Files.copy(source, out));
    }

    public Path copyFrom(InputStream source) throws IOException {
        return write(source::transferTo);
    }
}
