package com.chicu.trafficvolume.web.controller.api;

import com.chicu.trafficvolume.common.error.ErrorKind;
import com.chicu.trafficvolume.common.error.TrafficApiException;
import com.chicu.trafficvolume.web.dto.ErrorResponseDto;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Every failure leaves as {@code {"error": ..., "detail": ...}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler(TrafficApiException.class)
    public ResponseEntity<ErrorResponseDto> handleApi(TrafficApiException e, HttpServletRequest req) {
        ErrorKind kind = e.kind();
        if (kind.isClientError()) {
            log.warn("{} at {}: {}", kind.status().value(), safePath(req), safeMsg(e));
        } else {
            log.error("{} at {}: {}", kind.status().value(), safePath(req), safeMsg(e), e.getCause());
        }
        return build(kind.status(), kind.code(), safeMsg(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        log.warn("400 Bad Request at {}: {}", safePath(req), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR.code(),
                "Invalid input data: request body must be a JSON object");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponseDto> handleMediaType(HttpMediaTypeNotSupportedException e, HttpServletRequest req) {
        log.warn("415 Unsupported Media Type at {}: {}", safePath(req), e.getContentType());
        return build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported_media_type",
                "Content-Type must be application/json");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponseDto> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e,
                                                                   HttpServletRequest req) {
        log.warn("405 Method Not Allowed at {}: {}", safePath(req), e.getMethod());
        return build(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                e.getMethod() + " is not supported for " + safePath(req));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NoResourceFoundException e, HttpServletRequest req) {
        log.debug("404 at {}", safePath(req));
        return build(HttpStatus.NOT_FOUND, "not_found", "No endpoint " + safePath(req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handle(Exception e, HttpServletRequest req) {
        log.error("500 at {}: {}", safePath(req), safeMsg(e), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error");
    }

    // ---------- helpers ----------

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status).body(ErrorResponseDto.of(error, detail));
    }

    private String safeMsg(Throwable e) {
        String m = (e != null ? e.getMessage() : null);
        return (m != null && !m.isBlank()) ? m : (e != null ? e.getClass().getSimpleName() : "Error");
    }

    private String safePath(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
