package com.williamcallahan.scormingest.web;

import com.williamcallahan.scormingest.service.archive.CorruptArchiveException;
import com.williamcallahan.scormingest.service.todo.TodoNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps exceptions to {@link ApiErrorResponse} bodies, including the framework exceptions that
 * {@link ResponseEntityExceptionHandler} would otherwise render as problem details.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String FILE_TOO_LARGE_MESSAGE = "File too large";
    static final String TODO_NOT_FOUND_MESSAGE = "Todo not found";

    private final ExceptionResponseBuilder exceptionBuilder;

    public ApiExceptionHandler(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(InvalidUploadException.class)
    public ResponseEntity<Object> handleInvalidUpload(InvalidUploadException invalidUpload) {
        log.info("Rejected upload: {}", invalidUpload.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, invalidUpload.getMessage());
    }

    @ExceptionHandler(CorruptArchiveException.class)
    public ResponseEntity<Object> handleCorruptArchive(CorruptArchiveException corruptArchive) {
        log.warn("Rejected archive: {}", corruptArchive.getMessage());
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_REQUEST, "Invalid or corrupted zip file", corruptArchive);
    }

    @ExceptionHandler(TodoNotFoundException.class)
    public ResponseEntity<Object> handleTodoNotFound(TodoNotFoundException notFound) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, TODO_NOT_FOUND_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleUnexpected(Exception exception) {
        if (exception instanceof MaxUploadSizeExceededException) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.PAYLOAD_TOO_LARGE, FILE_TOO_LARGE_MESSAGE);
        }
        log.error("Unexpected error while handling request", exception);
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", exception);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError == null || fieldError.getDefaultMessage() == null
                ? "Request validation failed"
                : fieldError.getDefaultMessage();
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Request body is missing or malformed");
    }

    /**
     * Renders every remaining framework exception (missing multipart part, upload size limit,
     * unsupported method and so on) in the shared error shape.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex,
            @Nullable Object body,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode,
            @NonNull WebRequest request) {
        String message;
        if (statusCode.value() == HttpStatus.PAYLOAD_TOO_LARGE.value()) {
            message = FILE_TOO_LARGE_MESSAGE;
        } else if (ex instanceof MissingServletRequestPartException) {
            message = ScormUploadController.NO_FILE_PART_MESSAGE;
        } else if (ex instanceof ErrorResponse errorResponse && errorResponse.getBody().getDetail() != null) {
            message = errorResponse.getBody().getDetail();
        } else {
            message = exceptionBuilder.describeException(ex);
        }
        return ResponseEntity.status(statusCode).headers(headers).body(ApiErrorResponse.error(message));
    }
}
