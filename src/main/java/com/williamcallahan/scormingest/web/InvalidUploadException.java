package com.williamcallahan.scormingest.web;

/**
 * Rejects an upload request before any processing starts.
 */
public class InvalidUploadException extends RuntimeException {

    public InvalidUploadException(String message) {
        super(message);
    }
}
