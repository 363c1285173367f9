package com.williamcallahan.scormingest.web;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of a todo creation request.
 *
 * @param title todo text
 * @param completed initial completion flag, false when absent
 */
public record TodoCreateRequest(@NotBlank(message = "Title is required") String title, Boolean completed) {}
