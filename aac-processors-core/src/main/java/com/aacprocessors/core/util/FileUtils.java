package com.aacprocessors.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Arrays;
import java.util.Locale;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file extension in lower case, for case-insensitive format lookup.
     *
     * @param path file path
     * @return lower-case extension without dot, or empty string
     */
    public static String getNormalizedExtension(Path path) {
        return getExtension(path).toLowerCase(Locale.ROOT);
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

    /**
     * Turns arbitrary display text into a name usable as a file or archive folder name.
     *
     * @param name display text
     * @param fallback value used when nothing printable remains
     * @return sanitized name
     */
    public static String sanitizeFileName(String name, String fallback) {
        if (name == null) {
            return fallback;
        }
        String sanitized = name.trim().replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_");
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    /**
     * Checks whether a file starts with the given bytes.
     *
     * @param path file to inspect
     * @param magic expected leading bytes
     * @return true if the file is at least as long as {@code magic} and starts with it
     * @throws IOException if the file cannot be read
     */
    public static boolean startsWith(Path path, byte[] magic) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] head = in.readNBytes(magic.length);
            return Arrays.equals(head, magic);
        }
    }

    /**
     * Deletes a file or directory tree. Missing paths are ignored.
     *
     * @param root file or directory to delete
     * @throws IOException if an entry cannot be deleted
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
