package com.libragraph.artifacts.core.cache;

import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * One in-flight population of a cache object.
 *
 * <p>Bytes go to a temporary file next to the target. {@link #commit()} syncs it and
 * renames it over the target in one atomic step; {@link #close()} without a commit
 * discards the temporary file, so an aborted write never reaches the target path.
 */
public class CacheWrite implements Closeable {

    private static final Logger log = Logger.getLogger(CacheWrite.class);

    private final Path target;
    private final Path tempFile;
    private final FileChannel channel;
    private final OutputStream stream;
    private boolean done;

    CacheWrite(Path target, Path tempFile) throws IOException {
        this.target = target;
        this.tempFile = tempFile;
        this.channel = FileChannel.open(tempFile,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        this.stream = Channels.newOutputStream(channel);
    }

    /**
     * Stream writing into the temporary file. Closing it does not commit.
     */
    public OutputStream outputStream() {
        return stream;
    }

    public Path tempFile() {
        return tempFile;
    }

    /**
     * Bytes written so far.
     */
    public long size() throws IOException {
        return channel.size();
    }

    /**
     * Makes the written bytes visible at the target path.
     *
     * @return the target path
     */
    public Path commit() throws IOException {
        if (done) {
            throw new IllegalStateException("Cache write already finished: " + target);
        }
        done = true;
        try {
            channel.force(true);
            channel.close();
            try {
                Files.move(tempFile, target,
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                // Same directory, so this only happens on exotic filesystems.
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discard();
            throw e;
        }
        log.debugf("Cached object committed: %s", target);
        return target;
    }

    /**
     * Discards the write unless it was committed.
     */
    @Override
    public void close() throws IOException {
        if (done) {
            return;
        }
        done = true;
        discard();
    }

    private void discard() throws IOException {
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }
}
