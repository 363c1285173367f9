package com.williamcallahan.scormingest.service.manifest;

/**
 * Signals that {@code imsmanifest.xml} is not well-formed or exceeds the supported nesting depth.
 */
public class MalformedManifestException extends Exception {

    public MalformedManifestException(String message) {
        super(message);
    }

    public MalformedManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
