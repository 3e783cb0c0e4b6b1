package com.nisfix.compliance.exception;

import com.nisfix.compliance.config.TenantContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.OffsetDateTime;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ErrorResponse} bodies with a fixed status per error type.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ComplianceException.class)
    public ResponseEntity<ErrorResponse> handleCompliance(ComplianceException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Unhandled compliance error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} on {} {}: {}", ex.getErrorCode(), request.getMethod(), request.getRequestURI(),
                    ex.getMessage());
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex instanceof RateLimitExceededException rate) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(rate.getWindowMinutes() * 60L));
        }
        return builder.body(body(ex.getErrorCode(), ex.getMessage(), status, request));
    }

    static HttpStatus statusFor(ComplianceException ex) {
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof AlreadyExistsException
                || ex instanceof AlreadyUsedException
                || ex instanceof ConcurrentUpdateException) return HttpStatus.CONFLICT;
        if (ex instanceof ExpiredException
                || ex instanceof InvalidLinkException
                || ex instanceof InvalidTokenException) return HttpStatus.UNAUTHORIZED;
        if (ex instanceof RateLimitExceededException) return HttpStatus.TOO_MANY_REQUESTS;
        if (ex instanceof InvalidTransitionException
                || ex instanceof CannotModifyException
                || ex instanceof CannotReviewException
                || ex instanceof NotEditableException
                || ex instanceof CannotAssignException
                || ex instanceof ValidationFailedException) return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("Validation failed on {}: {}", request.getRequestURI(), message);
        return ResponseEntity.badRequest()
                .body(body("VALIDATION_FAILED", message, HttpStatus.BAD_REQUEST, request));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(body("VALIDATION_FAILED", "malformed request", HttpStatus.BAD_REQUEST, request));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        log.warn("Concurrent update on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body("CONCURRENT_UPDATE", "the resource was modified concurrently, please retry",
                        HttpStatus.CONFLICT, request));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(body("FORBIDDEN", "Insufficient role", HttpStatus.FORBIDDEN, request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {} (organization {}): {}", request.getMethod(), request.getRequestURI(),
                TenantContext.getOrganizationId(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "an unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR,
                        request));
    }

    private static ErrorResponse body(String code, String message, HttpStatus status, HttpServletRequest request) {
        return new ErrorResponse(code, message, status.value(), OffsetDateTime.now(), request.getRequestURI());
    }
}
