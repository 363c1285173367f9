package com.williamcallahan.scormingest.web;

import com.williamcallahan.scormingest.service.pipeline.PipelineResponse;
import com.williamcallahan.scormingest.service.pipeline.ScormIngestionService;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Accepts SCORM package uploads and returns the per-stage processing results.
 */
@RestController
public class ScormUploadController {
    private static final Logger log = LoggerFactory.getLogger(ScormUploadController.class);

    static final String UPLOAD_PATH = "/api/upload-scorm";
    static final String NO_FILE_PART_MESSAGE = "No file part in the request";
    static final String NO_SELECTED_FILE_MESSAGE = "No selected file";
    static final String EMPTY_FILE_MESSAGE = "Uploaded file is empty";
    static final String NOT_A_ZIP_MESSAGE = "Invalid file type. Please upload a .zip file";

    private static final Set<String> ZIP_CONTENT_TYPES =
            Set.of("application/zip", "application/x-zip-compressed", "application/x-zip");

    private final ScormIngestionService ingestionService;

    public ScormUploadController(ScormIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * Extracts the uploaded package, parses its manifest and processes the first SCO.
     *
     * @param file multipart {@code file} field holding the zip package
     * @return pipeline results; manifest, text and enrichment failures are reported in the body
     * @throws IOException when the upload cannot be staged on disk
     */
    @PostMapping(value = UPLOAD_PATH, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PipelineResponse> uploadScorm(@RequestParam(name = "file", required = false) MultipartFile file)
            throws IOException {
        validateUpload(file);
        log.info("Received package upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream archiveStream = file.getInputStream()) {
            return ResponseEntity.ok(ingestionService.ingest(archiveStream, file.getOriginalFilename()));
        }
    }

    private static void validateUpload(MultipartFile file) {
        if (file == null) {
            throw new InvalidUploadException(NO_FILE_PART_MESSAGE);
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new InvalidUploadException(NO_SELECTED_FILE_MESSAGE);
        }
        if (file.isEmpty()) {
            throw new InvalidUploadException(EMPTY_FILE_MESSAGE);
        }
        if (!isZipUpload(originalFilename, file.getContentType())) {
            throw new InvalidUploadException(NOT_A_ZIP_MESSAGE);
        }
    }

    /**
     * Accepts a {@code .zip} file name or a zip content type.
     */
    static boolean isZipUpload(String originalFilename, String contentType) {
        boolean zipName = originalFilename != null && originalFilename.toLowerCase(Locale.ROOT).endsWith(".zip");
        boolean zipType = contentType != null && ZIP_CONTENT_TYPES.contains(contentType.toLowerCase(Locale.ROOT));
        return zipName || zipType;
    }
}
