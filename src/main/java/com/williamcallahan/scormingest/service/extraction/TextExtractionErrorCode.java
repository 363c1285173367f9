package com.williamcallahan.scormingest.service.extraction;

/**
 * Reasons SCO text could not be extracted.
 */
public enum TextExtractionErrorCode {
    FILE_NOT_FOUND,
    PARSE_FAILURE
}
