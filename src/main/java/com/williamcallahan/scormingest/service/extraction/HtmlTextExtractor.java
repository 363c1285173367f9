package com.williamcallahan.scormingest.service.extraction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Pulls readable text out of a SCO's HTML launch page.
 *
 * <p>jsoup parses leniently, so broken markup still yields text; only I/O problems fail.</p>
 */
@Service
public class HtmlTextExtractor {

    // Non-content elements, removed with their descendants before reading text
    private static final String REMOVE_SELECTOR = "script, style, noscript, iframe, head";

    // Lets jsoup honour a BOM or <meta charset>, falling back to UTF-8
    private static final String DETECT_CHARSET = null;

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");

    /**
     * Extracts the body text of an HTML file with whitespace runs collapsed to single spaces.
     *
     * @param htmlFile HTML document on disk
     * @return extracted text, or a failure when the file is missing or unreadable
     */
    public TextExtractionOutcome extractText(Path htmlFile) {
        if (htmlFile == null || !Files.isRegularFile(htmlFile)) {
            return TextExtractionOutcome.failed(TextExtractionErrorCode.FILE_NOT_FOUND,
                    "HTML file not found at path: " + htmlFile);
        }
        Document document;
        try {
            document = Jsoup.parse(htmlFile.toFile(), DETECT_CHARSET);
        } catch (IOException ioException) {
            return TextExtractionOutcome.failed(TextExtractionErrorCode.PARSE_FAILURE,
                    "Error processing HTML content: " + ioException.getMessage());
        }
        return TextExtractionOutcome.extracted(extractText(document));
    }

    /**
     * Extracts normalized body text from an already parsed document. The document is modified.
     */
    public String extractText(Document document) {
        document.select(REMOVE_SELECTOR).remove();
        Element body = document.body();
        if (body == null) {
            return "";
        }
        return normalizeWhitespace(body.text());
    }

    static String normalizeWhitespace(String text) {
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }
}
