package com.williamcallahan.scormingest.service.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of asking the provider for course metadata.
 */
public sealed interface EnrichmentOutcome permits EnrichmentOutcome.Enriched, EnrichmentOutcome.Failed {

    /**
     * Returns the provider's JSON payload when enrichment succeeded. The payload is passed through
     * unvalidated, so every field should be treated as optional.
     */
    Optional<JsonNode> metadata();

    static EnrichmentOutcome enriched(JsonNode metadata) {
        return new Enriched(metadata);
    }

    static EnrichmentOutcome failed(EnrichmentFailureCause cause, String message) {
        return new Failed(cause, null, message, null);
    }

    static EnrichmentOutcome failed(EnrichmentFailureCause cause, Integer httpStatus, String message, String rawPayload) {
        return new Failed(cause, httpStatus, message, rawPayload);
    }

    record Enriched(JsonNode payload) implements EnrichmentOutcome {
        public Enriched {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public Optional<JsonNode> metadata() {
            return Optional.of(payload);
        }
    }

    /**
     * @param cause failure category
     * @param httpStatus provider status code, when a response was received
     * @param message human-readable explanation
     * @param rawPayload raw provider body or envelope kept for diagnosis, when available
     */
    record Failed(EnrichmentFailureCause cause, Integer httpStatus, String message, String rawPayload)
            implements EnrichmentOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Optional<JsonNode> metadata() {
            return Optional.empty();
        }
    }
}
