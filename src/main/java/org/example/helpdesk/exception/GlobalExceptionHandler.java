package org.example.helpdesk.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.AuthProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Maps every exception raised by controllers and by the auth interceptors to an
 * {@link ErrorResponse}.
 *
 * <p>Uses {@code @Order(Ordered.HIGHEST_PRECEDENCE)} so that it takes priority
 * over Spring's default exception handling.</p>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.example.helpdesk")
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final AuthProperties authProperties;
    private final Clock clock;

    // ==================== SPRING MVC EXCEPTIONS ====================

    /**
     * Handles a missing or malformed request body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, WebRequest request) {

        log.error("❌ HTTP MESSAGE NOT READABLE - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", getReadableMessage(ex), request);
    }

    private String getReadableMessage(HttpMessageNotReadableException ex) {
        String originalMessage = ex.getMessage();

        if (originalMessage == null) {
            return "Request body is missing or cannot be read. Please provide valid JSON.";
        }
        if (originalMessage.contains("Required request body is missing")
                || originalMessage.contains("No content to map due to end-of-input")) {
            return "Request body is required. Please provide a valid JSON payload.";
        }

        // enum @JsonCreator failures carry a readable message
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof IllegalArgumentException && cause.getMessage() != null) {
            return cause.getMessage();
        }
        if (originalMessage.contains("JSON parse error")) {
            return "Invalid JSON format. Please check your request body syntax.";
        }
        return "Invalid request body. Please provide valid JSON.";
    }

    /**
     * Handles {@code @Valid} failures.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, WebRequest request) {

        log.error("❌ VALIDATION FAILED - {}", ex.getMessage());

        Map<String, String> fieldErrors = new TreeMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        String message = "Validation failed: " + fieldErrors.entrySet().stream()
                .map(e -> e.getKey() + " - " + e.getValue())
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingServletRequestParameter(
            MissingServletRequestParameterException ex, WebRequest request) {

        log.error("❌ MISSING PARAMETER - {}", ex.getMessage());

        String message = String.format("Required parameter '%s' of type '%s' is missing",
                ex.getParameterName(), ex.getParameterType());
        return build(HttpStatus.BAD_REQUEST, "Missing Parameter", message, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatch(
            MethodArgumentTypeMismatchException ex, WebRequest request) {

        log.error("❌ TYPE MISMATCH - {}", ex.getMessage());

        String message = String.format("Parameter '%s' should be of type '%s' but received '%s'",
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown",
                ex.getValue());
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", message, request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, WebRequest request) {

        log.error("❌ UNSUPPORTED MEDIA TYPE - {}", ex.getMessage());

        String message = String.format("Content type '%s' is not supported. Supported types: %s",
                ex.getContentType(), ex.getSupportedMediaTypes());
        return build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", message, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, WebRequest request) {

        log.error("❌ METHOD NOT ALLOWED - {}", ex.getMessage());

        String message = String.format("HTTP method '%s' is not supported for this endpoint. Supported methods: %s",
                ex.getMethod(), ex.getSupportedHttpMethods());
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", message, request);
    }

    // ==================== AUTH EXCEPTIONS ====================

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex, WebRequest request) {

        log.warn("⚠️ LOGIN REJECTED - {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(
            UnauthenticatedException ex, WebRequest request) {

        log.warn("⚠️ UNAUTHENTICATED - {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidToken(
            InvalidTokenException ex, WebRequest request) {

        log.warn("⚠️ INVALID TOKEN - {}", ex.getReason());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidRefreshTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRefreshToken(
            InvalidRefreshTokenException ex, WebRequest request) {

        log.warn("⚠️ INVALID REFRESH TOKEN - {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(
            ForbiddenException ex, WebRequest request) {

        log.warn("⚠️ FORBIDDEN - {} (role: {}, required: {})",
                ex.getMessage(), ex.getUserRole(), ex.getRequiredRoles());

        ErrorResponse error = new ErrorResponse(
                LocalDateTime.now(clock),
                HttpStatus.FORBIDDEN.value(),
                "Forbidden",
                ex.getMessage(),
                request.getDescription(false)
        );
        if (authProperties.isExposeRequiredRoles() && ex.getUserRole() != null) {
            error.setUserRole(ex.getUserRole());
            error.setRequiredRoles(ex.getRequiredRoles());
        }
        return new ResponseEntity<>(error, HttpStatus.FORBIDDEN);
    }

    // ==================== BUSINESS EXCEPTIONS ====================

    @ExceptionHandler(TicketNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTicketNotFound(
            TicketNotFoundException ex, WebRequest request) {

        log.warn("⚠️ TICKET NOT FOUND - {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Ticket Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(
            UserNotFoundException ex, WebRequest request) {

        log.warn("⚠️ USER NOT FOUND - {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "User Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(DuplicateEmailException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateEmail(
            DuplicateEmailException ex, WebRequest request) {

        log.warn("⚠️ DUPLICATE EMAIL - {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Duplicate Email", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOperation(
            InvalidOperationException ex, WebRequest request) {

        log.error("❌ INVALID OPERATION - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Operation", ex.getMessage(), request);
    }

    @ExceptionHandler(NullRequestException.class)
    public ResponseEntity<ErrorResponse> handleNullRequest(
            NullRequestException ex, WebRequest request) {

        log.error("❌ NULL REQUEST - Field: {}, Message: {}", ex.getField(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Null Request", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, WebRequest request) {

        log.error("❌ ILLEGAL ARGUMENT - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(
            DataIntegrityViolationException ex, WebRequest request) {

        log.error("❌ DATA INTEGRITY VIOLATION - {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.CONFLICT, "Conflict",
                "The request conflicts with existing data", request);
    }

    // ==================== SYSTEM EXCEPTIONS ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(
            Exception ex, WebRequest request) {

        log.error("💥 UNHANDLED EXCEPTION - {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, WebRequest request) {
        ErrorResponse body = new ErrorResponse(
                LocalDateTime.now(clock),
                status.value(),
                error,
                message,
                request.getDescription(false)
        );
        return new ResponseEntity<>(body, status);
    }
}
