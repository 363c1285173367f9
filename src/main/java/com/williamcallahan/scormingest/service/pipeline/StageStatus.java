package com.williamcallahan.scormingest.service.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a pipeline stage ended: it did not run, ran and failed, or ran and succeeded.
 */
public enum StageStatus {
    SUCCESS("success"),
    ERROR("error"),
    SKIPPED("skipped");

    private final String wireName;

    StageStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
