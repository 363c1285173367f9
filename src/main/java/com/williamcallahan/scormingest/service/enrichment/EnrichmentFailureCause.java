package com.williamcallahan.scormingest.service.enrichment;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why metadata enrichment produced no metadata.
 *
 * <p>{@link #MISSING_KEY} and {@link #EMPTY_INPUT} are decided locally before any request is
 * sent; the remaining causes describe a provider call that was attempted.</p>
 */
public enum EnrichmentFailureCause {
    MISSING_KEY("missing_key", false),
    EMPTY_INPUT("empty_input", false),
    RATE_LIMITED("rate_limited", true),
    HTTP_ERROR("http_error", true),
    MALFORMED_RESPONSE("malformed_response", true),
    TRANSPORT_ERROR("transport_error", true);

    private final String wireName;
    private final boolean attempted;

    EnrichmentFailureCause(String wireName, boolean attempted) {
        this.wireName = wireName;
        this.attempted = attempted;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns true when a provider request was sent before the failure was known.
     */
    public boolean attempted() {
        return attempted;
    }
}
