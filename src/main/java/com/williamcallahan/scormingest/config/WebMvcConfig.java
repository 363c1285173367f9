package com.williamcallahan.scormingest.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * MVC configuration for CORS on the API endpoints.
 *
 * <p>The upload page is served separately from this backend, so {@code /api/**} must accept
 * cross-origin multipart posts from the configured origins.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private static final String WILDCARD_ORIGIN = "*";

    private final List<String> allowedOrigins;
    private final List<String> allowedMethods;
    private final List<String> allowedHeaders;
    private final boolean allowCredentials;
    private final long maxAgeSeconds;

    /**
     * Creates MVC config with application properties for CORS rules.
     *
     * @param appProperties application configuration properties
     */
    public WebMvcConfig(AppProperties appProperties) {
        var cors = appProperties.getCors();
        cors.validateConfiguration();
        this.allowedOrigins = cors.getAllowedOrigins();
        this.allowedMethods = cors.getAllowedMethods();
        this.allowedHeaders = cors.getAllowedHeaders();
        this.allowCredentials = cors.isAllowCredentials();
        this.maxAgeSeconds = cors.getMaxAgeSeconds();
    }

    /**
     * Configures CORS for API endpoints using the configured allow lists.
     *
     * @param registry CORS registry to update
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        var mapping = registry.addMapping("/api/**");
        if (allowedOrigins.contains(WILDCARD_ORIGIN)) {
            mapping.allowedOriginPatterns(WILDCARD_ORIGIN);
        } else {
            mapping.allowedOrigins(allowedOrigins.toArray(String[]::new));
        }
        mapping.allowedMethods(allowedMethods.toArray(String[]::new))
                .allowedHeaders(allowedHeaders.toArray(String[]::new))
                .allowCredentials(allowCredentials)
                .maxAge(maxAgeSeconds);
    }
}
