package com.williamcallahan.scormingest.service.enrichment;

/**
 * Fixed instruction sent with every enrichment request.
 */
final class EnrichmentPrompt {

    private static final String TEMPLATE = """
            You are cataloguing e-learning content. Read the course text below and respond with a \
            single JSON object containing exactly these keys:
            - "title": a concise course title
            - "summary": a summary of the content in 4-5 sentences
            - "keywords": an array of 7-10 keyword strings
            - "learning_objectives": an array of 2-4 strings, each beginning with an imperative verb
            - "language": the natural-language name of the language the text is written in

            Respond with JSON only.

            Course text:
            %s
            """;

    private EnrichmentPrompt() {}

    /**
     * Embeds the text verbatim into the instruction template.
     */
    static String render(String courseText) {
        return TEMPLATE.formatted(courseText);
    }
}
