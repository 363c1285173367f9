package com.williamcallahan.scormingest.domain.manifest;

/**
 * Reasons a package manifest could not be turned into a {@link CourseManifest}.
 */
public enum ManifestErrorCode {
    MANIFEST_NOT_FOUND,
    MANIFEST_UNREADABLE,
    MALFORMED_XML,
    INVALID_MANIFEST_ROOT
}
