package com.codereview.orchestrator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Keeps uploaded source files on local disk until their review runs.
 *
 * Files are written as {@code {uploadDir}/{uuid}_{fileName}} so two uploads
 * with the same name never collide.
 */
@Component
public class SourceFileStore implements SourceReader {

    private static final Logger log = LoggerFactory.getLogger(SourceFileStore.class);

    private final Path         uploadDir;
    private final long         maxFileSize;
    private final List<String> allowedExtensions;

    public SourceFileStore(
            @Value("${codereview.storage.upload-dir:uploads}") String uploadDir,
            @Value("${codereview.storage.max-file-size:10485760}") long maxFileSize,
            @Value("${codereview.storage.allowed-extensions:.py,.js,.ts,.java,.cpp,.c,.go,.rs,.rb}")
            List<String> allowedExtensions) {
        this.uploadDir         = Path.of(uploadDir);
        this.maxFileSize       = maxFileSize;
        this.allowedExtensions = allowedExtensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Check an upload before anything is written.
     *
     * @throws IllegalArgumentException with a user-facing message when rejected
     */
    public void validate(String fileName, long size) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        String ext = extensionOf(fileName);
        if (!allowedExtensions.contains(ext)) {
            throw new IllegalArgumentException("Unsupported file type '" + ext
                    + "'. Supported types: " + allowedExtensions);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("File is empty");
        }
        if (size > maxFileSize) {
            throw new IllegalArgumentException("File exceeds the " + maxFileSize + " byte limit");
        }
    }

    /** Write an upload to disk and return where it went. */
    public Path save(String fileName, byte[] content) {
        validate(fileName, content.length);
        Path target = uploadDir.resolve(UUID.randomUUID() + "_" + sanitize(fileName));
        try {
            Files.createDirectories(uploadDir);
            Files.write(target, content);
            log.info("Stored upload '{}' at {} ({} bytes)", fileName, target, content.length);
            return target;
        } catch (IOException e) {
            throw new SourceStorageException("Could not store upload '" + fileName + "'", e);
        }
    }

    /** Read a stored source file as UTF-8 text. */
    @Override
    public String read(String filePath) {
        try {
            return Files.readString(Path.of(filePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceStorageException("Could not read source file " + filePath, e);
        }
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** Strip any directory component and characters unsafe in a file name. */
    public static String sanitize(String fileName) {
        String base = Path.of(fileName.replace('\\', '/')).getFileName().toString();
        return base.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
