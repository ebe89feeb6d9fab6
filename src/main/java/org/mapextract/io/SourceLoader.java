package org.mapextract.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes text loading for the extractors: reads a whole asset from the local
 * filesystem or the classpath before any parsing starts. Content is decoded as UTF-8,
 * a leading byte order mark is dropped and line endings are normalized to {@code \n}.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The file to read.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read; the message names the path.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        try {
            String content = normalize(Files.readString(path, StandardCharsets.UTF_8));
            return new LoadResult(content, logicalName);
        } catch (IOException e) {
            throw new IOException("Failed to read " + logicalName + ": " + e, e);
        }
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            String content = normalize(new String(is.readAllBytes(), StandardCharsets.UTF_8));
            return new LoadResult(content, resourcePath);
        }
    }

    static String normalize(String text) {
        if (text.startsWith(BYTE_ORDER_MARK)) {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
