package com.williamcallahan.scormingest.logging;

import com.williamcallahan.scormingest.service.pipeline.ScormIngestionService;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Logging aspect for the stages of the package ingestion pipeline.
 * Each stage is logged with the request id, its step number and its duration.
 */
@Aspect
@Component
public class PipelineStageLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private static final String UNKNOWN_REQUEST = "REQ-unknown";

    /**
     * Log archive extraction
     */
    @Around("execution(* com.williamcallahan.scormingest.service.archive.ArchiveExtractor.extract(..))")
    public Object logArchiveExtraction(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, 1, "ARCHIVE EXTRACTION");
    }

    /**
     * Log manifest parsing
     */
    @Around("execution(* com.williamcallahan.scormingest.service.manifest.ManifestParser.parse(..))")
    public Object logManifestParsing(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, 2, "MANIFEST PARSING");
    }

    /**
     * Log text extraction
     */
    @Around("execution(* com.williamcallahan.scormingest.service.extraction.HtmlTextExtractor.extractText(java.nio.file.Path))")
    public Object logTextExtraction(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, 3, "TEXT EXTRACTION");
    }

    /**
     * Log metadata enrichment
     */
    @Around("execution(* com.williamcallahan.scormingest.service.enrichment.MetadataEnrichmentClient.enrich(..))")
    public Object logMetadataEnrichment(ProceedingJoinPoint joinPoint) throws Throwable {
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof String text) {
            PIPELINE_LOG.debug("[{}] Enrichment input length: {}", requestId(), text.length());
        }
        return logStage(joinPoint, 4, "METADATA ENRICHMENT");
    }

    private Object logStage(ProceedingJoinPoint joinPoint, int step, String stageName) throws Throwable {
        String requestId = requestId();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] STEP {}: {} - Starting", requestId, step, stageName);
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] STEP {}: {} - Completed in {}ms", requestId, step, stageName, duration);
            return result;
        } catch (Exception stageException) {
            PIPELINE_LOG.error("[{}] STEP {}: {} - Failed: {}", requestId, step, stageName, stageException.getMessage());
            throw stageException;
        }
    }

    private static String requestId() {
        String requestId = MDC.get(ScormIngestionService.REQUEST_ID_KEY);
        return requestId == null ? UNKNOWN_REQUEST : requestId;
    }
}
