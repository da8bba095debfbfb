package com.aacprocessors.core.processor.base;

import com.aacprocessors.core.exception.FormatException;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.exception.ZipException;
import net.lingala.zip4j.io.outputstream.ZipOutputStream;
import net.lingala.zip4j.model.FileHeader;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.CompressionMethod;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory view of a zip archive that keeps entry order.
 *
 * <p>Entries are read fully into memory, edited by name, and written back in their
 * original order with new entries appended. Entries that are not replaced are written
 * with exactly the bytes they were read with. Entry contents are copied on the way in
 * and on the way out, so callers never share an array with the container.
 */
public final class ZipContainer {

    private final Map<String, byte[]> entries = new LinkedHashMap<>();

    /**
     * Creates an empty container.
     */
    public ZipContainer() {
    }

    /**
     * Reads every file entry of an archive.
     *
     * @param file archive to read
     * @param formatName vendor format name used in error messages
     * @return container holding all entries
     * @throws NoSuchFileException if the file does not exist
     * @throws FormatException if the file is not a readable zip archive
     * @throws IOException if the file cannot be read
     */
    public static ZipContainer read(Path file, String formatName) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        ZipContainer container = new ZipContainer();
        try (ZipFile zipFile = new ZipFile(file.toFile())) {
            if (!zipFile.isValidZipFile()) {
                throw new FormatException(formatName + " file is not a valid zip archive: " + file);
            }
            List<FileHeader> headers = zipFile.getFileHeaders();
            for (FileHeader header : headers) {
                if (header.isDirectory()) {
                    continue;
                }
                try (InputStream in = zipFile.getInputStream(header)) {
                    container.entries.put(header.getFileName(), in.readAllBytes());
                } catch (IOException e) {
                    throw new FormatException(formatName + " archive entry " + header.getFileName()
                        + " is corrupt: " + file + " (" + e.getMessage() + ")", e);
                }
            }
        } catch (ZipException e) {
            throw new FormatException(formatName + " archive is corrupt: " + file + " (" + e.getMessage() + ")", e);
        }
        return container;
    }

    /**
     * Returns entry names in archive order.
     */
    public List<String> names() {
        return List.copyOf(entries.keySet());
    }

    /**
     * Returns entry names matching a predicate, in archive order.
     */
    public List<String> names(Predicate<String> filter) {
        return entries.keySet().stream().filter(filter).toList();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * Returns a copy of an entry's content.
     */
    public Optional<byte[]> get(String name) {
        return Optional.ofNullable(entries.get(name)).map(byte[]::clone);
    }

    /**
     * Adds or replaces an entry. Replaced entries keep their position.
     */
    public ZipContainer put(String name, byte[] content) {
        entries.put(Objects.requireNonNull(name, "name must not be null"),
            Objects.requireNonNull(content, "content must not be null").clone());
        return this;
    }

    public ZipContainer remove(String name) {
        entries.remove(name);
        return this;
    }

    /**
     * Returns a snapshot of all entries in archive order, with copied contents.
     */
    public Map<String, byte[]> entries() {
        Map<String, byte[]> snapshot = new LinkedHashMap<>();
        entries.forEach((name, content) -> snapshot.put(name, content.clone()));
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Writes all entries as a deflated zip archive.
     *
     * @param target file to write
     * @throws IOException if writing fails
     */
    public void write(Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zipOut = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                ZipParameters parameters = new ZipParameters();
                parameters.setFileNameInZip(entry.getKey());
                parameters.setCompressionMethod(CompressionMethod.DEFLATE);
                zipOut.putNextEntry(parameters);
                zipOut.write(entry.getValue());
                zipOut.closeEntry();
            }
        }
    }
}
