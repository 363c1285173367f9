package com.williamcallahan.scormingest.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Logs at startup whether SCO text will be sent for metadata enrichment.
 */
@Configuration
public class EnrichmentKeyLoggingConfig {
    private static final Logger logger = LoggerFactory.getLogger(EnrichmentKeyLoggingConfig.class);
    private static final int VISIBLE_KEY_CHARS = 4;

    private final AppProperties appProperties;

    @Value("${spring.profiles.active:dev}")
    private String activeProfile;

    public EnrichmentKeyLoggingConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @PostConstruct
    public void logEnrichmentKeyStatus() {
        AppProperties.Enrichment enrichment = appProperties.getEnrichment();
        String apiKey = enrichment.getApiKey();
        boolean isDev = "dev".equalsIgnoreCase(activeProfile);

        logger.info("=== Enrichment Configuration Status ===");
        if (!hasValue(apiKey)) {
            logger.warn("ENRICHMENT_API_KEY: Not configured - uploads will report enrichment as skipped");
        } else if (isDev) {
            logger.info("ENRICHMENT_API_KEY: Configured (***{})", maskApiKey(apiKey));
        } else {
            logger.info("ENRICHMENT_API_KEY: Configured");
        }
        logger.info("Enrichment endpoint: {} (model {}, timeout {}s)",
                enrichment.getBaseUrl(), enrichment.getModel(), enrichment.getTimeoutSeconds());
        logger.info("SCORM work directory: {} (retain extracted: {})",
                appProperties.getScorm().getWorkDir(), appProperties.getScorm().isRetainExtracted());
        logger.info("=======================================");
    }

    private boolean hasValue(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private String maskApiKey(String key) {
        if (key.length() <= VISIBLE_KEY_CHARS) {
            return "****";
        }
        return key.substring(key.length() - VISIBLE_KEY_CHARS);
    }
}
