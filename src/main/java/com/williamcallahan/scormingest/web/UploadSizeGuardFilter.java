package com.williamcallahan.scormingest.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects package uploads before the body is read: requests that are not {@code multipart/form-data}
 * and requests whose declared {@code Content-Length} exceeds the multipart request limit. Chunked
 * uploads without a length fall through to the multipart limits.
 */
@Component
public class UploadSizeGuardFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(UploadSizeGuardFilter.class);

    private static final String MULTIPART_FORM_DATA = "multipart/form-data";

    private final long maxRequestBytes;
    private final ObjectMapper objectMapper;

    public UploadSizeGuardFilter(
            @Value("${spring.servlet.multipart.max-request-size:201MB}") DataSize maxRequestSize,
            ObjectMapper objectMapper) {
        this.maxRequestBytes = maxRequestSize.toBytes();
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !"POST".equalsIgnoreCase(request.getMethod()) || !ScormUploadController.UPLOAD_PATH.equals(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String contentType = request.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith(MULTIPART_FORM_DATA)) {
            log.info("Rejected upload with content type {}", contentType);
            writeError(response, HttpStatus.BAD_REQUEST, ApiErrorResponse.error(
                    ScormUploadController.NO_FILE_PART_MESSAGE, "Expected a multipart/form-data request"));
            return;
        }
        long declaredLength = request.getContentLengthLong();
        if (declaredLength > maxRequestBytes) {
            log.info("Rejected upload of {} bytes (limit {})", declaredLength, maxRequestBytes);
            writeError(response, HttpStatus.PAYLOAD_TOO_LARGE, ApiErrorResponse.error(
                    ApiExceptionHandler.FILE_TOO_LARGE_MESSAGE,
                    "Maximum upload size is " + DataSize.ofBytes(maxRequestBytes).toMegabytes() + "MB"));
            return;
        }
        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, HttpStatus status, ApiErrorResponse body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
