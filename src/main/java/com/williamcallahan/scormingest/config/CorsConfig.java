package com.williamcallahan.scormingest.config;

import java.util.List;
import java.util.Locale;

/**
 * CORS settings for the upload and todo APIs, bound under {@code app.cors}.
 */
public class CorsConfig {

    private static final String WILDCARD = "*";
    private static final List<String> ORIGINS_DEF = List.of(WILDCARD);
    private static final List<String> METHODS_DEF = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");
    private static final List<String> HEADERS_DEF = List.of(WILDCARD);
    private static final long MAX_AGE_DEF = 3_600L;
    private static final String ORIGINS_KEY = "app.cors.allowed-origins";
    private static final String METHODS_KEY = "app.cors.allowed-methods";
    private static final String HEADERS_KEY = "app.cors.allowed-headers";
    private static final String MAX_AGE_KEY = "app.cors.max-age-seconds";
    private static final String NULL_LIST_FMT = "%s must not be null.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";

    private List<String> allowedOrigins = ORIGINS_DEF;
    private List<String> allowedMethods = METHODS_DEF;
    private List<String> allowedHeaders = HEADERS_DEF;
    private boolean allowCredentials = false;
    private long maxAgeSeconds = MAX_AGE_DEF;

    /**
     * Validates CORS settings.
     */
    public void validateConfiguration() {
        requireNonNullList(ORIGINS_KEY, allowedOrigins);
        requireNonNullList(METHODS_KEY, allowedMethods);
        requireNonNullList(HEADERS_KEY, allowedHeaders);
        if (maxAgeSeconds < 0L) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, MAX_AGE_KEY));
        }
    }

    public List<String> getAllowedOrigins() {
        return List.copyOf(allowedOrigins);
    }

    public void setAllowedOrigins(final List<String> allowedOrigins) {
        this.allowedOrigins = requireNonNullList(ORIGINS_KEY, allowedOrigins);
    }

    public List<String> getAllowedMethods() {
        return List.copyOf(allowedMethods);
    }

    public void setAllowedMethods(final List<String> allowedMethods) {
        this.allowedMethods = requireNonNullList(METHODS_KEY, allowedMethods);
    }

    public List<String> getAllowedHeaders() {
        return List.copyOf(allowedHeaders);
    }

    public void setAllowedHeaders(final List<String> allowedHeaders) {
        this.allowedHeaders = requireNonNullList(HEADERS_KEY, allowedHeaders);
    }

    public boolean isAllowCredentials() {
        return allowCredentials;
    }

    public void setAllowCredentials(final boolean allowCredentials) {
        this.allowCredentials = allowCredentials;
    }

    public long getMaxAgeSeconds() {
        return maxAgeSeconds;
    }

    public void setMaxAgeSeconds(final long maxAgeSeconds) {
        this.maxAgeSeconds = maxAgeSeconds;
    }

    private static List<String> requireNonNullList(final String propertyKey, final List<String> entries) {
        if (entries == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_LIST_FMT, propertyKey));
        }
        return List.copyOf(entries);
    }
}
