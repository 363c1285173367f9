package com.williamcallahan.scormingest.service.archive;

/**
 * Thrown when an uploaded package cannot be unpacked safely: not a zip, damaged entries,
 * entries escaping the extraction directory, or contents exceeding the configured limits.
 */
public class CorruptArchiveException extends RuntimeException {

    public CorruptArchiveException(String message) {
        super(message);
    }

    public CorruptArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
