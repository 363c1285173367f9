package com.williamcallahan.scormingest.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Scorm scorm = new Scorm();
    private Enrichment enrichment = new Enrichment();
    private CorsConfig cors = new CorsConfig();

    public Scorm getScorm() {
        return scorm;
    }

    public void setScorm(Scorm scorm) {
        this.scorm = scorm;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public CorsConfig getCors() {
        return cors;
    }

    public void setCors(CorsConfig cors) {
        this.cors = cors;
    }

    public static class Scorm {
        private String workDir = Path.of(System.getProperty("java.io.tmpdir"), "scorm-uploads").toString();
        private boolean retainExtracted = false;
        private int textPreviewLength = 500;
        private int maxEntries = 10_000;
        private long maxUncompressedBytes = 1024L * 1024L * 1024L;

        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }

        public boolean isRetainExtracted() { return retainExtracted; }
        public void setRetainExtracted(boolean retainExtracted) { this.retainExtracted = retainExtracted; }

        public int getTextPreviewLength() { return textPreviewLength; }
        public void setTextPreviewLength(int textPreviewLength) { this.textPreviewLength = textPreviewLength; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public long getMaxUncompressedBytes() { return maxUncompressedBytes; }
        public void setMaxUncompressedBytes(long maxUncompressedBytes) { this.maxUncompressedBytes = maxUncompressedBytes; }
    }

    public static class Enrichment {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private int timeoutSeconds = 45;
        private int maxPromptChars = 30_000;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public int getMaxPromptChars() { return maxPromptChars; }
        public void setMaxPromptChars(int maxPromptChars) { this.maxPromptChars = maxPromptChars; }
    }
}
