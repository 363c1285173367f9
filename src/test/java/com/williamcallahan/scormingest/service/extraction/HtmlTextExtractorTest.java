package com.williamcallahan.scormingest.service.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies SCO page text extraction and whitespace normalization.
 */
class HtmlTextExtractorTest {

    private final HtmlTextExtractor extractor = new HtmlTextExtractor();

    @Test
    void dropsHeadScriptsAndCollapsesWhitespace() {
        String html = "<html><head><script>x</script></head><body> Hello <b>World</b>  </body></html>";

        assertEquals("Hello World", extractor.extractText(Jsoup.parse(html)));
    }

    @Test
    void removesNonContentElementsAndNonBreakingSpaces() {
        String html = """
                <html><body>
                  <style>p { color: red; }</style>
                  <p>Tee&nbsp;&nbsp;off</p>
                  <script>trackProgress();</script>
                  <noscript>Enable JavaScript</noscript>
                  <iframe src="frame.html">frame fallback</iframe>
                  <p>then
                     putt</p>
                </body></html>
                """;

        assertEquals("Tee off then putt", extractor.extractText(Jsoup.parse(html)));
    }

    @Test
    void extractsTextFromFileOnDisk(@TempDir Path tempDir) throws IOException {
        Path page = tempDir.resolve("Playing.html");
        Files.writeString(page, "<html><body><h1>Par</h1><p>Par is the expected score.</p></body></html>",
                StandardCharsets.UTF_8);

        TextExtractionOutcome outcome = extractor.extractText(page);

        assertEquals(Optional.of("Par Par is the expected score."), outcome.text());
    }

    @Test
    void emptyBodyIsASuccessfulEmptyResult(@TempDir Path tempDir) throws IOException {
        Path page = tempDir.resolve("empty.html");
        Files.writeString(page, "<html><head><title>Nothing</title></head><body>   </body></html>",
                StandardCharsets.UTF_8);

        TextExtractionOutcome outcome = extractor.extractText(page);

        assertEquals(Optional.of(""), outcome.text());
    }

    @Test
    void malformedMarkupStillYieldsText(@TempDir Path tempDir) throws IOException {
        Path page = tempDir.resolve("broken.html");
        Files.writeString(page, "<div><p>Unclosed <b>bold<p>next", StandardCharsets.UTF_8);

        TextExtractionOutcome outcome = extractor.extractText(page);

        assertEquals(Optional.of("Unclosed bold next"), outcome.text());
    }

    @Test
    void reportsMissingFile(@TempDir Path tempDir) {
        TextExtractionOutcome outcome = extractor.extractText(tempDir.resolve("missing.html"));

        TextExtractionOutcome.Failed failed = assertInstanceOf(TextExtractionOutcome.Failed.class, outcome);
        assertEquals(TextExtractionErrorCode.FILE_NOT_FOUND, failed.code());
        assertTrue(failed.reason().startsWith("HTML file not found at path: "));
    }

    @Test
    void treatsDirectoryAsMissingFile(@TempDir Path tempDir) {
        TextExtractionOutcome outcome = extractor.extractText(tempDir);

        TextExtractionOutcome.Failed failed = assertInstanceOf(TextExtractionOutcome.Failed.class, outcome);
        assertEquals(TextExtractionErrorCode.FILE_NOT_FOUND, failed.code());
    }
}
