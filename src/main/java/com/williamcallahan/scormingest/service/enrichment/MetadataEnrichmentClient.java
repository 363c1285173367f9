package com.williamcallahan.scormingest.service.enrichment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.scormingest.config.AppProperties;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Asks an OpenAI-compatible chat completions endpoint for structured course metadata.
 *
 * <p>Every failure is reported as an {@link EnrichmentOutcome.Failed} value rather than thrown,
 * so a provider outage never fails the upload that triggered it.</p>
 */
@Service
public class MetadataEnrichmentClient {
    private static final Logger log = LoggerFactory.getLogger(MetadataEnrichmentClient.class);

    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";
    private static final int HTTP_OK = 200;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int MAX_ERROR_SNIPPET = 512;

    private final String baseUrl;
    private final String model;
    private final int maxPromptChars;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public MetadataEnrichmentClient(
            AppProperties appProperties, RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper) {
        this(
                appProperties.getEnrichment().getBaseUrl(),
                appProperties.getEnrichment().getModel(),
                Duration.ofSeconds(appProperties.getEnrichment().getTimeoutSeconds()),
                appProperties.getEnrichment().getMaxPromptChars(),
                restTemplateBuilder,
                objectMapper);
    }

    MetadataEnrichmentClient(
            String baseUrl,
            String model,
            Duration timeout,
            int maxPromptChars,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper) {
        if (maxPromptChars <= 0) {
            throw new IllegalArgumentException("maxPromptChars must be positive");
        }
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.model = Objects.requireNonNull(model, "model");
        this.maxPromptChars = maxPromptChars;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.restTemplate = restTemplateBuilder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    /**
     * Requests metadata for the given course text.
     *
     * @param text plain text extracted from the course
     * @param apiKey provider key; blank means enrichment is not configured
     * @return provider metadata, or the reason none was produced
     */
    public EnrichmentOutcome enrich(String text, String apiKey) {
        if (text == null || text.isBlank()) {
            return EnrichmentOutcome.failed(EnrichmentFailureCause.EMPTY_INPUT, "No text content to enrich");
        }
        if (apiKey == null || apiKey.isBlank()) {
            return EnrichmentOutcome.failed(EnrichmentFailureCause.MISSING_KEY, "Enrichment API key is not configured");
        }

        String promptText = text.length() > maxPromptChars ? text.substring(0, maxPromptChars) : text;
        ChatCompletionRequest request = new ChatCompletionRequest(
                model,
                List.of(new ChatMessage("user", EnrichmentPrompt.render(promptText))),
                new ResponseFormat("json_object"));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        String url = baseUrl + CHAT_COMPLETIONS_PATH;
        log.debug("[ENRICHMENT] Requesting metadata from {} ({} chars)", url, promptText.length());

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(request, headers), String.class);
        } catch (RestClientResponseException httpException) {
            return httpFailure(httpException.getStatusCode().value(), httpException.getResponseBodyAsString());
        } catch (RestClientException transportException) {
            return transportFailure(transportException);
        }

        int statusCode = response.getStatusCode().value();
        if (statusCode != HTTP_OK) {
            return httpFailure(statusCode, response.getBody());
        }
        return parseEnvelope(response.getBody());
    }

    private EnrichmentOutcome parseEnvelope(String envelope) {
        JsonNode envelopeNode;
        try {
            envelopeNode = envelope == null ? null : objectMapper.readTree(envelope);
        } catch (JsonProcessingException parseException) {
            return malformed("Provider response was not valid JSON", envelope);
        }
        JsonNode content = envelopeNode == null
                ? null
                : envelopeNode.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            return malformed("Provider response did not contain choices[0].message.content", envelope);
        }

        String contentText = content.asText();
        try {
            JsonNode metadata = objectMapper.readTree(stripCodeFence(contentText));
            if (metadata == null || metadata.isMissingNode()) {
                return malformed("Provider returned empty metadata content", contentText);
            }
            log.info("[ENRICHMENT] Received metadata with {} field(s)", metadata.size());
            return EnrichmentOutcome.enriched(metadata);
        } catch (JsonProcessingException parseException) {
            return malformed("Provider metadata content was not valid JSON", contentText);
        }
    }

    /**
     * Removes a surrounding Markdown code fence such as {@code ```json ... ```} if present.
     */
    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstLineEnd = trimmed.indexOf('\n');
        if (firstLineEnd < 0) {
            return trimmed;
        }
        String body = trimmed.substring(firstLineEnd + 1);
        int closingFence = body.lastIndexOf("```");
        if (closingFence >= 0) {
            body = body.substring(0, closingFence);
        }
        return body.trim();
    }

    private static EnrichmentOutcome httpFailure(int statusCode, String body) {
        EnrichmentFailureCause cause = statusCode == HTTP_TOO_MANY_REQUESTS
                ? EnrichmentFailureCause.RATE_LIMITED
                : EnrichmentFailureCause.HTTP_ERROR;
        String snippet = sanitizeMessage(body);
        String message = snippet.isBlank()
                ? "Enrichment provider returned HTTP " + statusCode
                : "Enrichment provider returned HTTP " + statusCode + ": " + snippet;
        log.warn("[ENRICHMENT] {}", message);
        return EnrichmentOutcome.failed(cause, statusCode, message, body);
    }

    private EnrichmentOutcome transportFailure(RestClientException exception) {
        String details = sanitizeMessage(exception.getMessage());
        String message = details.isBlank()
                ? "Enrichment request failed against " + baseUrl
                : "Enrichment request failed against " + baseUrl + ": " + details;
        log.warn("[ENRICHMENT] {}", message);
        return EnrichmentOutcome.failed(EnrichmentFailureCause.TRANSPORT_ERROR, message);
    }

    private static EnrichmentOutcome malformed(String message, String raw) {
        log.warn("[ENRICHMENT] {}", message);
        return EnrichmentOutcome.failed(EnrichmentFailureCause.MALFORMED_RESPONSE, null, message, raw);
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private record ChatCompletionRequest(
            String model,
            List<ChatMessage> messages,
            @JsonProperty("response_format") ResponseFormat responseFormat) {}

    private record ChatMessage(String role, String content) {}

    private record ResponseFormat(String type) {}
}
