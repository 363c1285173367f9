package com.williamcallahan.scormingest.web;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness text for the server root.
 */
@RestController
public class RootController {

    static final String ROOT_MESSAGE =
            "SCORM API Server is running. Use /api/upload-scorm to upload SCORM packages.";

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String root() {
        return ROOT_MESSAGE;
    }
}
