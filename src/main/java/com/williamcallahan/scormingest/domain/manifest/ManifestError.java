package com.williamcallahan.scormingest.domain.manifest;

import java.util.Objects;

/**
 * Structured manifest failure reported back to the uploader.
 *
 * @param code failure category
 * @param message human-readable detail, including the XML parser message when available
 */
public record ManifestError(ManifestErrorCode code, String message) {

    public ManifestError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }
}
