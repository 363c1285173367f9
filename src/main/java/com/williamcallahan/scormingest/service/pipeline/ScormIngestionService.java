package com.williamcallahan.scormingest.service.pipeline;

import com.williamcallahan.scormingest.config.AppProperties;
import com.williamcallahan.scormingest.domain.manifest.CourseManifest;
import com.williamcallahan.scormingest.domain.manifest.Sco;
import com.williamcallahan.scormingest.service.archive.ArchiveExtractor;
import com.williamcallahan.scormingest.service.archive.UploadWorkspace;
import com.williamcallahan.scormingest.service.enrichment.MetadataEnrichmentClient;
import com.williamcallahan.scormingest.service.extraction.HtmlTextExtractor;
import com.williamcallahan.scormingest.service.extraction.TextExtractionErrorCode;
import com.williamcallahan.scormingest.service.extraction.TextExtractionOutcome;
import com.williamcallahan.scormingest.service.manifest.ManifestParseOutcome;
import com.williamcallahan.scormingest.service.manifest.ManifestParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs one uploaded package through extraction, manifest parsing, text extraction and enrichment.
 *
 * <p>Only archive problems abort a run. Manifest, text and enrichment failures are recorded in the
 * returned {@link PipelineResponse}. The temporary archive is always removed; the extraction
 * directory is removed too unless {@code app.scorm.retain-extracted} is set.</p>
 */
@Service
public class ScormIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ScormIngestionService.class);

    public static final String REQUEST_ID_KEY = "requestId";

    static final String NOTE_MANIFEST_FAILED = "Manifest could not be parsed";
    static final String NOTE_NO_SCOS = "No processable SCOs found";
    static final String NOTE_MISSING_HREF = "First SCO has no launch href; text extraction skipped";
    static final String NOTE_NOT_HTML = "First SCO is not an HTML document; text extraction skipped";
    private static final String PREVIEW_ELLIPSIS = "...";

    private final UploadWorkspace uploadWorkspace;
    private final ArchiveExtractor archiveExtractor;
    private final ManifestParser manifestParser;
    private final HtmlTextExtractor htmlTextExtractor;
    private final MetadataEnrichmentClient enrichmentClient;
    private final AppProperties appProperties;

    public ScormIngestionService(
            UploadWorkspace uploadWorkspace,
            ArchiveExtractor archiveExtractor,
            ManifestParser manifestParser,
            HtmlTextExtractor htmlTextExtractor,
            MetadataEnrichmentClient enrichmentClient,
            AppProperties appProperties) {
        this.uploadWorkspace = uploadWorkspace;
        this.archiveExtractor = archiveExtractor;
        this.manifestParser = manifestParser;
        this.htmlTextExtractor = htmlTextExtractor;
        this.enrichmentClient = enrichmentClient;
        this.appProperties = appProperties;
    }

    /**
     * Processes an uploaded package.
     *
     * @param archiveStream uploaded zip bytes
     * @param originalFilename client-supplied file name, used to name the extraction directory
     * @return per-stage results
     * @throws com.williamcallahan.scormingest.service.archive.CorruptArchiveException when the archive cannot be extracted
     * @throws IOException when the work directory cannot be written
     */
    public PipelineResponse ingest(InputStream archiveStream, String originalFilename) throws IOException {
        String previousRequestId = MDC.get(REQUEST_ID_KEY);
        MDC.put(REQUEST_ID_KEY, "REQ-" + UUID.randomUUID().toString().substring(0, 8));
        boolean retainExtracted = appProperties.getScorm().isRetainExtracted();
        Path extractionDir = null;
        try {
            Path archiveFile = uploadWorkspace.storeArchive(archiveStream);
            extractionDir = uploadWorkspace.newExtractionDirectory(originalFilename);
            try {
                int fileCount = archiveExtractor.extract(archiveFile, extractionDir);
                log.info("Extracted {} file(s) from {} into {}", fileCount, originalFilename, extractionDir.getFileName());
            } finally {
                uploadWorkspace.delete(archiveFile);
            }
            PipelineResponse response = process(extractionDir, retainExtracted);
            log.info("Pipeline complete: manifest={}, text={}, enrichment={}",
                    response.manifestParsingStatus(),
                    response.textExtraction() == null ? "-" : response.textExtraction().status(),
                    response.enrichment() == null ? "-" : response.enrichment().status());
            return response;
        } finally {
            if (extractionDir != null && !retainExtracted) {
                uploadWorkspace.delete(extractionDir);
            }
            if (previousRequestId == null) {
                MDC.remove(REQUEST_ID_KEY);
            } else {
                MDC.put(REQUEST_ID_KEY, previousRequestId);
            }
        }
    }

    private PipelineResponse process(Path extractionDir, boolean retainExtracted) {
        PipelineResponse.Builder response =
                PipelineResponse.builder(extractionDir.getFileName().toString(), retainExtracted);

        ManifestParseOutcome parseOutcome = manifestParser.parse(extractionDir);
        if (parseOutcome instanceof ManifestParseOutcome.Failed failed) {
            return response.manifestFailed(failed.detail()).processingNote(NOTE_MANIFEST_FAILED).build();
        }
        CourseManifest courseManifest = parseOutcome.manifest().orElseThrow();
        response.manifestParsed(courseManifest);

        Optional<Sco> firstSco = courseManifest.firstSco();
        if (firstSco.isEmpty()) {
            return response.processingNote(NOTE_NO_SCOS).build();
        }
        Sco sco = firstSco.get();
        response.processedSco(sco);

        if (!sco.hasHref()) {
            return response
                    .textExtraction(TextExtractionReport.skipped("SCO '" + sco.identifier() + "' has no launch href"))
                    .enrichment(EnrichmentReport.notRun("No text was extracted"))
                    .processingNote(NOTE_MISSING_HREF)
                    .build();
        }

        String contentPath = sco.contentPath();
        if (!isHtmlDocument(contentPath)) {
            return response
                    .textExtraction(TextExtractionReport.skipped("SCO launch file is not HTML: " + contentPath))
                    .enrichment(EnrichmentReport.notRun("No text was extracted"))
                    .processingNote(NOTE_NOT_HTML)
                    .build();
        }

        TextExtractionOutcome textOutcome = extractScoText(extractionDir, contentPath);
        if (textOutcome instanceof TextExtractionOutcome.Failed failed) {
            return response
                    .textExtraction(TextExtractionReport.failed(failed.code(), failed.reason()))
                    .enrichment(EnrichmentReport.notRun("Text extraction failed"))
                    .build();
        }
        String text = textOutcome.text().orElseThrow();
        response.textExtraction(TextExtractionReport.extracted(preview(text), text.length()));

        String apiKey = appProperties.getEnrichment().getApiKey();
        return response.enrichment(EnrichmentReport.from(enrichmentClient.enrich(text, apiKey))).build();
    }

    private TextExtractionOutcome extractScoText(Path extractionDir, String contentPath) {
        Path root = extractionDir.toAbsolutePath().normalize();
        Path htmlFile;
        try {
            htmlFile = root.resolve(contentPath).normalize();
        } catch (InvalidPathException invalidPath) {
            return TextExtractionOutcome.failed(TextExtractionErrorCode.FILE_NOT_FOUND,
                    "SCO launch path is not a valid file path: " + contentPath);
        }
        if (!htmlFile.startsWith(root)) {
            return TextExtractionOutcome.failed(TextExtractionErrorCode.FILE_NOT_FOUND,
                    "SCO launch path points outside the package: " + contentPath);
        }
        return htmlTextExtractor.extractText(htmlFile);
    }

    private String preview(String text) {
        int previewLength = appProperties.getScorm().getTextPreviewLength();
        if (text.length() <= previewLength) {
            return text;
        }
        return text.substring(0, previewLength) + PREVIEW_ELLIPSIS;
    }

    /**
     * Returns true for {@code .html} and {@code .htm} paths, ignoring case.
     */
    static boolean isHtmlDocument(String contentPath) {
        String lowerPath = contentPath.toLowerCase(Locale.ROOT);
        return lowerPath.endsWith(".html") || lowerPath.endsWith(".htm");
    }
}
