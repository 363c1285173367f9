package com.williamcallahan.scormingest.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.scormingest.service.extraction.TextExtractionErrorCode;
import java.util.Objects;

/**
 * Text extraction stage as reported to the uploader.
 *
 * @param status stage result
 * @param textContent preview of the extracted text
 * @param textLength length of the full extracted text
 * @param errorCode failure category when the stage failed
 * @param reason why the stage failed or was skipped
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TextExtractionReport(
        @JsonProperty("status") StageStatus status,
        @JsonProperty("text_content") String textContent,
        @JsonProperty("text_length") Integer textLength,
        @JsonProperty("error_code") TextExtractionErrorCode errorCode,
        @JsonProperty("reason") String reason) {

    public TextExtractionReport {
        Objects.requireNonNull(status, "status");
    }

    static TextExtractionReport extracted(String preview, int fullLength) {
        return new TextExtractionReport(StageStatus.SUCCESS, preview, fullLength, null, null);
    }

    static TextExtractionReport failed(TextExtractionErrorCode errorCode, String reason) {
        return new TextExtractionReport(StageStatus.ERROR, null, null, errorCode, reason);
    }

    static TextExtractionReport skipped(String reason) {
        return new TextExtractionReport(StageStatus.SKIPPED, null, null, null, reason);
    }
}
