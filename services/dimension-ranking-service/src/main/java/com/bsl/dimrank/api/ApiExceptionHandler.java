package com.bsl.dimrank.api;

import com.bsl.dimrank.api.dto.ErrorResponse;
import com.bsl.dimrank.config.ConfigurationException;
import com.bsl.dimrank.index.CandidateFetchException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        ErrorResponse body = errorResponse(
            "bad_request",
            "Invalid request body",
            request
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(CandidateFetchException.class)
    public ResponseEntity<ErrorResponse> handleCandidateFetch(CandidateFetchException ex, HttpServletRequest request) {
        log.warn("candidate fetch failed: {}", ex.getMessage());
        ErrorResponse body = errorResponse(
            "candidate_fetch_failed",
            "Similarity index unavailable: " + ex.getMessage(),
            request
        );
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        ErrorResponse body = errorResponse(
            "configuration_error",
            ex.getMessage(),
            request
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unexpected error path={}", request.getRequestURI(), ex);
        ErrorResponse body = errorResponse(
            "internal_error",
            "Unexpected error",
            request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse errorResponse(String code, String message, HttpServletRequest request) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.TRACE_HEADER);
        String requestId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.REQUEST_HEADER);
        return new ErrorResponse(code, message, traceId, requestId);
    }
}
