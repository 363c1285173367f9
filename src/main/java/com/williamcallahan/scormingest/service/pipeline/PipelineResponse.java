package com.williamcallahan.scormingest.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.scormingest.domain.manifest.CourseManifest;
import com.williamcallahan.scormingest.domain.manifest.ManifestError;
import com.williamcallahan.scormingest.domain.manifest.Sco;

/**
 * Aggregate result of one package upload. Stages that never ran are left null and omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResponse(
        @JsonProperty("message") String message,
        @JsonProperty("extracted_content_path") String extractedContentPath,
        @JsonProperty("extracted_content_retained") boolean extractedContentRetained,
        @JsonProperty("manifest_parsing_status") StageStatus manifestParsingStatus,
        @JsonProperty("manifest_data") CourseManifest manifestData,
        @JsonProperty("manifest_error_details") ManifestError manifestErrorDetails,
        @JsonProperty("processed_sco") Sco processedSco,
        @JsonProperty("text_extraction") TextExtractionReport textExtraction,
        @JsonProperty("enrichment") EnrichmentReport enrichment,
        @JsonProperty("processing_note") String processingNote) {

    public static final String UPLOAD_SUCCESS_MESSAGE = "File uploaded and extracted successfully";

    static Builder builder(String extractedContentPath, boolean extractedContentRetained) {
        return new Builder(extractedContentPath, extractedContentRetained);
    }

    static final class Builder {
        private final String extractedContentPath;
        private final boolean extractedContentRetained;
        private StageStatus manifestParsingStatus;
        private CourseManifest manifestData;
        private ManifestError manifestErrorDetails;
        private Sco processedSco;
        private TextExtractionReport textExtraction;
        private EnrichmentReport enrichment;
        private String processingNote;

        private Builder(String extractedContentPath, boolean extractedContentRetained) {
            this.extractedContentPath = extractedContentPath;
            this.extractedContentRetained = extractedContentRetained;
        }

        Builder manifestParsed(CourseManifest courseManifest) {
            this.manifestParsingStatus = StageStatus.SUCCESS;
            this.manifestData = courseManifest;
            return this;
        }

        Builder manifestFailed(ManifestError error) {
            this.manifestParsingStatus = StageStatus.ERROR;
            this.manifestErrorDetails = error;
            return this;
        }

        Builder processedSco(Sco sco) {
            this.processedSco = sco;
            return this;
        }

        Builder textExtraction(TextExtractionReport report) {
            this.textExtraction = report;
            return this;
        }

        Builder enrichment(EnrichmentReport report) {
            this.enrichment = report;
            return this;
        }

        Builder processingNote(String note) {
            this.processingNote = note;
            return this;
        }

        PipelineResponse build() {
            return new PipelineResponse(
                    UPLOAD_SUCCESS_MESSAGE,
                    extractedContentPath,
                    extractedContentRetained,
                    manifestParsingStatus,
                    manifestData,
                    manifestErrorDetails,
                    processedSco,
                    textExtraction,
                    enrichment,
                    processingNote);
        }
    }
}
