package org.monitoring.service.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Content-addressed file store for uploaded datasets. A stored file is never rewritten:
 * identical uploads resolve to the same handle.
 */
@Slf4j
@Service
public class FileStorageService {

    private final Map<String, String> mimeToExtension = Map.of(
            "text/csv", ".csv",
            "text/tab-separated-values", ".tsv"
    );

    private final Path rootDirectory;

    public FileStorageService(@Value("${monitoring.storage.root:}") String rootDirectory) {
        if (StringUtils.hasText(rootDirectory)) {
            this.rootDirectory = Paths.get(rootDirectory).toAbsolutePath().normalize();
        } else {
            this.rootDirectory = Paths.get("").toAbsolutePath().resolve("data").normalize();
        }
        try {
            Files.createDirectories(this.rootDirectory);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to create storage directory: " + this.rootDirectory, ioException);
        }
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    public StoredFileMetadata storeDatasetFile(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File must not be empty");
        }

        String sanitizedName = sanitizeFilename(file.getOriginalFilename());
        if (!StringUtils.hasText(sanitizedName)) {
            sanitizedName = "dataset";
        }
        String extension = detectExtension(file, sanitizedName);

        ContentAddressedFile stored;
        try (InputStream inputStream = file.getInputStream()) {
            stored = persistContentAddressed(inputStream, extension);
        }

        String handle = rootDirectory.relativize(stored.absolutePath()).toString();
        log.info("[upload] Stored dataset file {} at {} (hash: {})", file.getOriginalFilename(), handle, stored.hash());

        return new StoredFileMetadata(
                handle,
                file.getOriginalFilename(),
                extension.substring(1).toLowerCase(Locale.ROOT),
                stored.sizeBytes(),
                stored.hash()
        );
    }

    /**
     * Resolves a storage handle back to a readable path, refusing anything outside the store.
     */
    public Path resolve(String handle) {
        if (!StringUtils.hasText(handle)) {
            throw new IllegalArgumentException("Storage handle is required");
        }
        Path resolved = rootDirectory.resolve(handle).normalize();
        if (!resolved.startsWith(rootDirectory)) {
            throw new IllegalArgumentException("Storage handle escapes the storage root: " + handle);
        }
        return resolved;
    }

    private String sanitizeFilename(String filename) {
        if (!StringUtils.hasText(filename)) {
            return "";
        }

        String normalized = Normalizer.normalize(filename, Normalizer.Form.NFD)
                .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
        normalized = normalized.replaceAll("[^a-zA-Z0-9._-]", "-");
        return normalized.replaceAll("-+", "-");
    }

    private String detectExtension(MultipartFile file, String filename) {
        if (filename != null && filename.contains(".")) {
            return filename.substring(filename.lastIndexOf('.')).toLowerCase(Locale.ROOT);
        }
        String mimeType = file.getContentType();
        if (mimeType != null && mimeToExtension.containsKey(mimeType)) {
            return mimeToExtension.get(mimeType);
        }
        return ".csv";
    }

    private ContentAddressedFile persistContentAddressed(InputStream inputStream, String extension) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            Path tempFile = Files.createTempFile(rootDirectory, "upload", extension);
            long written;
            try (DigestInputStream digestStream = new DigestInputStream(inputStream, digest)) {
                written = Files.copy(digestStream, tempFile, StandardCopyOption.REPLACE_EXISTING);
            }

            String hash = HexFormat.of().formatHex(digest.digest());
            Path hashedDirectory = rootDirectory.resolve(Paths.get(hash.substring(0, 2), hash.substring(2, 4)));
            Files.createDirectories(hashedDirectory);
            Path hashedPath = hashedDirectory.resolve(hash + extension);

            if (Files.exists(hashedPath)) {
                Files.deleteIfExists(tempFile);
            } else {
                Files.move(tempFile, hashedPath, StandardCopyOption.ATOMIC_MOVE);
            }

            return new ContentAddressedFile(hashedPath, written, hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest algorithm not available", e);
        }
    }

    public record StoredFileMetadata(String handle,
                                     String originalFilename,
                                     String format,
                                     long sizeBytes,
                                     String hash) {
    }

    private record ContentAddressedFile(Path absolutePath, long sizeBytes, String hash) {
    }
}
