package com.authplatform.validitysvc.api.error;

import com.authplatform.validitysvc.shared.exception.*;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to problem responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final SecurityUtils securityUtils;

    public GlobalExceptionHandler(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @ExceptionHandler(AccountValidityException.class)
    public ResponseEntity<ProblemDetail> handleAccountValidity(AccountValidityException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        if (ex.getHttpStatus() >= 500) {
            log.error("Account validity failure: type={}, correlationId={}", ex.getErrorCode(), correlationId, ex);
        } else {
            log.debug("Handled exception: type={}, correlationId={}", ex.getErrorCode(), correlationId);
        }
        return respond(ProblemDetail.forCode(ex.getErrorCode(), ex.getHttpStatus(), detailFor(ex),
                request.getRequestURI(), correlationId));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> errors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return validationProblem(request, "One or more validation errors occurred", Map.of("errors", errors));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                HttpServletRequest request) {
        return validationProblem(request, "Missing parameter: " + ex.getParameterName(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return validationProblem(request, "Malformed request body", Map.of());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return respond(ProblemDetail.forCode("FORBIDDEN", 403, "You are not allowed to perform this action",
                request.getRequestURI(), securityUtils.getCurrentCorrelationId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        log.error("Unexpected error: correlationId={}", correlationId, ex);
        return respond(ProblemDetail.forCode("INTERNAL_ERROR", 500, "An unexpected error occurred",
                request.getRequestURI(), correlationId));
    }

    private ResponseEntity<ProblemDetail> validationProblem(HttpServletRequest request, String detail,
                                                            Map<String, Object> extensions) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        log.debug("Validation error: correlationId={}, detail={}", correlationId, detail);
        return respond(ProblemDetail.forCode(VALIDATION_ERROR, 400, detail, request.getRequestURI(),
                correlationId, extensions));
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        return ResponseEntity.status(problem.status()).body(problem);
    }

    private static String detailFor(AccountValidityException ex) {
        if (ex instanceof MissingExpirationException) {
            return "The account has no expiration time";
        }
        if (ex instanceof TokenConflictException) {
            return "The renewal token is already in use";
        }
        if (ex instanceof ValidityRecordNotFoundException) {
            return "No validity record for this account";
        }
        if (ex instanceof TokenExhaustedException) {
            return "Could not issue a unique renewal token";
        }
        return "The account validity service could not complete the request";
    }
}
