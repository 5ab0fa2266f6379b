package com.steadycrawl.crawl.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * A JSON document replaced as a whole: bytes go to a temp file in the same directory, are forced to disk,
 * then renamed over the target. Readers see either the old or the new document, never a partial one.
 */
class AtomicJsonFile {
    private static final Logger log = LoggerFactory.getLogger(AtomicJsonFile.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path path;
    private final ObjectMapper objectMapper;

    AtomicJsonFile(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    Path path() {
        return path;
    }

    <T> Optional<T> read(TypeReference<T> type) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            if (Files.size(path) == 0) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + path, e);
        }
    }

    void write(Object value) {
        byte[] bytes;
        try {
            bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PersistenceException("Failed to serialize " + path.getFileName(), e);
        }

        Path temp = null;
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            temp = Files.createTempFile(path.toAbsolutePath().getParent(), path.getFileName() + ".", TEMP_SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp);
            temp = null;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + path, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Removes temp files left behind by a writer that died before its rename.
     *
     * @return number of files removed
     */
    int removeStaleTempFiles() {
        Path dir = path.toAbsolutePath().getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            return 0;
        }
        String prefix = path.getFileName() + ".";
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, prefix + "*" + TEMP_SUFFIX)) {
            for (Path entry : entries) {
                if (deleteQuietly(entry)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan {} for stale temp files", dir, e);
        }
        if (removed > 0) {
            log.warn("Removed {} incomplete temp file(s) for {}", removed, path.getFileName());
        }
        return removed;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}", file, e);
            return false;
        }
    }
}
