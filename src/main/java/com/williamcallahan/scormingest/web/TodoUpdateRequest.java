package com.williamcallahan.scormingest.web;

import jakarta.validation.constraints.Pattern;

/**
 * Partial todo update; null fields keep their current value.
 *
 * @param title replacement title
 * @param completed replacement completion flag
 */
public record TodoUpdateRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "Title must not be blank") String title,
        Boolean completed) {}
