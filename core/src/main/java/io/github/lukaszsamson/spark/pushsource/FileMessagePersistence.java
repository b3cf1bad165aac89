package io.github.lukaszsamson.spark.pushsource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * {@link MessagePersistence} keeping one file per key in a directory.
 *
 * <p>A value is written to a temporary file, forced to disk and then
 * atomically renamed to {@code <key>.msg}, so a crash leaves either the old
 * or the new value, never a torn one. Leftover temporary files are ignored.
 */
public final class FileMessagePersistence implements MessagePersistence {

    private static final Logger LOG = LoggerFactory.getLogger(FileMessagePersistence.class);

    static final String SUFFIX = ".msg";
    static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final boolean syncEnabled;
    private volatile boolean open;

    public FileMessagePersistence(Path directory) {
        this(directory, true);
    }

    /**
     * @param syncEnabled if false, writes are not forced to disk (tests only)
     */
    FileMessagePersistence(Path directory, boolean syncEnabled) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.syncEnabled = syncEnabled;
        if (!syncEnabled) {
            LOG.warn("FileMessagePersistence created with fsync disabled for {}", directory);
        }
    }

    @Override
    public synchronized void open() throws IOException {
        if (open) {
            return;
        }
        Files.createDirectories(directory);
        open = true;
        LOG.debug("Opened file persistence in {}", directory);
    }

    @Override
    public void put(String key, byte[] value) throws IOException {
        ensureOpen();
        Path target = fileFor(key);
        Path temp = directory.resolve(key + "." + Thread.currentThread().getId() + TEMP_SUFFIX);
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(value);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (syncEnabled) {
                channel.force(true);
            }
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    @Override
    public byte[] get(String key) throws IOException {
        ensureOpen();
        try {
            return Files.readAllBytes(fileFor(key));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public Set<String> keys() throws IOException {
        ensureOpen();
        Set<String> keys = new HashSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                keys.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        }
        return keys;
    }

    @Override
    public synchronized void close() {
        open = false;
    }

    private Path fileFor(String key) {
        if (key == null || key.isEmpty() || key.contains("/") || key.contains("\\")
                || key.startsWith(".")) {
            throw new IllegalArgumentException("Invalid persistence key: '" + key + "'");
        }
        return directory.resolve(key + SUFFIX);
    }

    private void ensureOpen() throws IOException {
        if (!open) {
            throw new IOException("File persistence in " + directory + " is not open");
        }
    }
}
