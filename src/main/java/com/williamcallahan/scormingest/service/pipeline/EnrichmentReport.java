package com.williamcallahan.scormingest.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.scormingest.service.enrichment.EnrichmentFailureCause;
import com.williamcallahan.scormingest.service.enrichment.EnrichmentOutcome;
import java.util.Objects;

/**
 * Metadata enrichment stage as reported to the uploader.
 *
 * @param status stage result
 * @param metadata provider metadata, passed through unvalidated
 * @param cause failure or skip category
 * @param httpStatus provider status code for HTTP failures
 * @param message explanation when no metadata was produced
 * @param rawResponse raw provider payload kept for diagnosis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnrichmentReport(
        @JsonProperty("status") StageStatus status,
        @JsonProperty("metadata") JsonNode metadata,
        @JsonProperty("cause") EnrichmentFailureCause cause,
        @JsonProperty("http_status") Integer httpStatus,
        @JsonProperty("message") String message,
        @JsonProperty("raw_response") String rawResponse) {

    public EnrichmentReport {
        Objects.requireNonNull(status, "status");
    }

    /**
     * Maps a client outcome onto the report; local precondition failures become skips.
     */
    static EnrichmentReport from(EnrichmentOutcome outcome) {
        if (outcome instanceof EnrichmentOutcome.Failed failed) {
            StageStatus status = failed.cause().attempted() ? StageStatus.ERROR : StageStatus.SKIPPED;
            return new EnrichmentReport(
                    status, null, failed.cause(), failed.httpStatus(), failed.message(), failed.rawPayload());
        }
        return new EnrichmentReport(StageStatus.SUCCESS, outcome.metadata().orElseThrow(), null, null, null, null);
    }

    static EnrichmentReport notRun(String message) {
        return new EnrichmentReport(StageStatus.SKIPPED, null, null, null, message, null);
    }
}
