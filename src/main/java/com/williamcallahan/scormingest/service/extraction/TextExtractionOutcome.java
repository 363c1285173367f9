package com.williamcallahan.scormingest.service.extraction;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of extracting readable text from a SCO document: the text or a failure, never both.
 */
public sealed interface TextExtractionOutcome
        permits TextExtractionOutcome.Extracted, TextExtractionOutcome.Failed {

    /**
     * Returns the extracted text when extraction succeeded. An empty string is a valid result.
     */
    Optional<String> text();

    static TextExtractionOutcome extracted(String text) {
        return new Extracted(text);
    }

    static TextExtractionOutcome failed(TextExtractionErrorCode code, String reason) {
        return new Failed(code, reason);
    }

    record Extracted(String content) implements TextExtractionOutcome {
        public Extracted {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public Optional<String> text() {
            return Optional.of(content);
        }
    }

    record Failed(TextExtractionErrorCode code, String reason) implements TextExtractionOutcome {
        public Failed {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Optional<String> text() {
            return Optional.empty();
        }
    }
}
