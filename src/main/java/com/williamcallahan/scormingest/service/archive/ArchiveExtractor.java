package com.williamcallahan.scormingest.service.archive;

import com.williamcallahan.scormingest.config.AppProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Unpacks an uploaded package into its own extraction directory.
 *
 * <p>Every entry is checked before anything is written: its normalized target must stay inside
 * the destination, and the entry count must stay within the configured limit. Written bytes are
 * counted against the uncompressed-size limit. Any failure removes the destination directory so
 * callers never see a half-extracted package.</p>
 */
@Service
public class ArchiveExtractor {
    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    private static final int COPY_BUFFER_SIZE = 8192;
    static final String CORRUPT_ARCHIVE_MESSAGE = "Invalid or corrupted zip file";

    private final int maxEntries;
    private final long maxUncompressedBytes;

    @Autowired
    public ArchiveExtractor(AppProperties appProperties) {
        this(appProperties.getScorm().getMaxEntries(), appProperties.getScorm().getMaxUncompressedBytes());
    }

    ArchiveExtractor(int maxEntries, long maxUncompressedBytes) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        if (maxUncompressedBytes <= 0) {
            throw new IllegalArgumentException("maxUncompressedBytes must be positive");
        }
        this.maxEntries = maxEntries;
        this.maxUncompressedBytes = maxUncompressedBytes;
    }

    /**
     * Extracts every entry of the archive under the destination directory, creating it if needed.
     * Existing files with the same names are overwritten.
     *
     * @param archiveFile zip file on disk
     * @param destinationDir directory that receives the package contents
     * @return number of files written
     * @throws CorruptArchiveException when the archive is unreadable or unsafe
     * @throws IOException when writing to the destination fails
     */
    public int extract(Path archiveFile, Path destinationDir) throws IOException {
        Objects.requireNonNull(archiveFile, "archiveFile");
        Objects.requireNonNull(destinationDir, "destinationDir");
        Path root = destinationDir.toAbsolutePath().normalize();
        Files.createDirectories(root);

        try (ZipFile zipFile = new ZipFile(archiveFile.toFile(), StandardCharsets.UTF_8)) {
            List<PlannedEntry> plan = planEntries(zipFile, root);
            return writeEntries(zipFile, plan);
        } catch (ZipException | IllegalArgumentException zipException) {
            discardPartialExtraction(root);
            throw new CorruptArchiveException(CORRUPT_ARCHIVE_MESSAGE + ": " + zipException.getMessage(), zipException);
        } catch (CorruptArchiveException | IOException extractionException) {
            discardPartialExtraction(root);
            throw extractionException;
        }
    }

    private List<PlannedEntry> planEntries(ZipFile zipFile, Path root) {
        List<PlannedEntry> plan = new ArrayList<>();
        Enumeration<? extends ZipEntry> entries = zipFile.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (plan.size() >= maxEntries) {
                throw new CorruptArchiveException("Archive contains more than " + maxEntries + " entries");
            }
            plan.add(new PlannedEntry(entry, resolveTarget(root, entry.getName())));
        }
        return plan;
    }

    /**
     * Resolves an entry name against the extraction root, rejecting names that escape it.
     */
    static Path resolveTarget(Path root, String entryName) {
        String normalizedName = entryName.replace('\\', '/');
        Path target = root.resolve(normalizedName).normalize();
        if (!target.startsWith(root)) {
            throw new CorruptArchiveException("Archive entry escapes the extraction directory: " + entryName);
        }
        return target;
    }

    private int writeEntries(ZipFile zipFile, List<PlannedEntry> plan) throws IOException {
        long totalBytes = 0L;
        int filesWritten = 0;
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        for (PlannedEntry planned : plan) {
            try {
                if (planned.entry().isDirectory()) {
                    Files.createDirectories(planned.target());
                    continue;
                }
                totalBytes = writeFile(zipFile, planned, buffer, totalBytes);
            } catch (FileSystemException conflict) {
                // A file and a directory claiming the same path
                throw new CorruptArchiveException(
                        "Archive entry conflicts with another entry: " + planned.entry().getName(), conflict);
            }
            filesWritten++;
        }
        log.debug("Extracted {} file(s), {} bytes", filesWritten, totalBytes);
        return filesWritten;
    }

    private long writeFile(ZipFile zipFile, PlannedEntry planned, byte[] buffer, long bytesSoFar) throws IOException {
        long totalBytes = bytesSoFar;
        Path parent = planned.target().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (InputStream entryStream = zipFile.getInputStream(planned.entry());
                OutputStream fileStream = Files.newOutputStream(planned.target())) {
            int read;
            while ((read = entryStream.read(buffer)) != -1) {
                totalBytes += read;
                if (totalBytes > maxUncompressedBytes) {
                    throw new CorruptArchiveException("Archive expands beyond " + maxUncompressedBytes + " bytes");
                }
                fileStream.write(buffer, 0, read);
            }
        }
        return totalBytes;
    }

    private static void discardPartialExtraction(Path root) {
        try {
            FileSystemUtils.deleteRecursively(root);
        } catch (IOException cleanupException) {
            log.warn("Could not remove partially extracted directory {}: {}", root, cleanupException.getMessage());
        }
    }

    private record PlannedEntry(ZipEntry entry, Path target) {}
}
