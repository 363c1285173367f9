package com.williamcallahan.scormingest.service.archive;

import com.williamcallahan.scormingest.config.AppProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Hands out request-scoped locations under the configured work directory.
 *
 * <p>Every upload gets a fresh random identifier, so concurrent requests never share a temporary
 * archive file or an extraction directory.</p>
 */
@Service
public class UploadWorkspace {
    private static final Logger log = LoggerFactory.getLogger(UploadWorkspace.class);

    private static final int MAX_BASE_NAME_LENGTH = 64;
    private static final String FALLBACK_BASE_NAME = "package";
    private static final String ARCHIVE_SUFFIX = ".zip";

    private final Path workRoot;

    @Autowired
    public UploadWorkspace(AppProperties appProperties) {
        this(Path.of(appProperties.getScorm().getWorkDir()));
    }

    UploadWorkspace(Path workRoot) {
        this.workRoot = workRoot.toAbsolutePath().normalize();
    }

    public Path workRoot() {
        return workRoot;
    }

    /**
     * Copies the uploaded archive to a uniquely named temporary file.
     *
     * @param archiveStream uploaded bytes
     * @return path of the stored archive
     * @throws IOException when the work directory cannot be written
     */
    public Path storeArchive(InputStream archiveStream) throws IOException {
        Files.createDirectories(workRoot);
        Path archiveFile = workRoot.resolve(UUID.randomUUID() + ARCHIVE_SUFFIX);
        try {
            Files.copy(archiveStream, archiveFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException copyException) {
            delete(archiveFile);
            throw copyException;
        }
        return archiveFile;
    }

    /**
     * Returns a new, not yet created extraction directory named after the uploaded file.
     *
     * @param originalFilename client-supplied file name, may be null
     * @return unique extraction directory path
     */
    public Path newExtractionDirectory(String originalFilename) {
        return workRoot.resolve(safeBaseName(originalFilename) + "_" + UUID.randomUUID());
    }

    /**
     * Removes a file or directory tree, logging instead of failing when removal is impossible.
     *
     * @param path file or directory to remove
     * @return true when something was deleted
     */
    public boolean delete(Path path) {
        if (path == null) {
            return false;
        }
        try {
            return FileSystemUtils.deleteRecursively(path);
        } catch (IOException deleteException) {
            log.warn("Failed to delete {}: {}", path, deleteException.getMessage());
            return false;
        }
    }

    /**
     * Reduces a client file name to a filesystem-safe base name without its extension.
     */
    static String safeBaseName(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return FALLBACK_BASE_NAME;
        }
        String fileName = originalFilename.replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);
        if (fileName.toLowerCase(Locale.ROOT).endsWith(ARCHIVE_SUFFIX)) {
            fileName = fileName.substring(0, fileName.length() - ARCHIVE_SUFFIX.length());
        }
        String safeName = fileName.replaceAll("[^a-zA-Z0-9._-]", "_").replaceAll("^\\.+", "");
        if (safeName.isEmpty()) {
            return FALLBACK_BASE_NAME;
        }
        return safeName.length() > MAX_BASE_NAME_LENGTH ? safeName.substring(0, MAX_BASE_NAME_LENGTH) : safeName;
    }
}
