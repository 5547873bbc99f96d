package com.docinsight.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private FileUtils() {
        // Utility class
    }

    /**
     * Writes text to a file through a sibling temp file and a rename.
     *
     * <p>Readers see either the previous content or the complete new content, never a
     * partially written file. Parent directories are created as needed.
     *
     * @param target file to write
     * @param content file content
     * @throws IOException if writing or moving fails
     */
    public static void writeAtomically(Path target, String content) throws IOException {
        Path temp = stage(target, content);
        try {
            publish(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes text to a hidden temp file next to {@code target} without touching the target.
     *
     * @param target file the content is destined for
     * @param content file content
     * @return staged temp file, to be passed to {@link #publish(Path, Path)}
     * @throws IOException if writing fails
     */
    public static Path stage(Path target, String content) throws IOException {
        Path temp = createSiblingTemp(target);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            return temp;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    /**
     * Moves a staged file over its target, atomically where the file system allows.
     *
     * @param staged staged temp file
     * @param target destination
     * @throws IOException if the move fails
     */
    public static void publish(Path staged, Path target) throws IOException {
        moveIntoPlace(staged, target);
    }

    /**
     * Copies a file through a sibling temp file and a rename.
     *
     * @param source file to copy
     * @param target destination file
     * @throws IOException if copying or moving fails
     */
    public static void copyAtomically(Path source, Path target) throws IOException {
        Path temp = createSiblingTemp(target);
        try {
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Deletes a file if it exists, logging instead of failing.
     *
     * @param path file to delete
     * @return true if a file was deleted
     */
    public static boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Deletes a directory tree, logging instead of failing.
     *
     * @param root directory to delete
     */
    public static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(FileUtils::deleteQuietly);
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", root, e.getMessage());
        }
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name
     */
    public static String getBaseName(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    private static Path createSiblingTemp(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        return Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
