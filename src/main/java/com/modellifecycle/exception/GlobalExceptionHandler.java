package com.modellifecycle.exception;

import com.modellifecycle.config.RequestIdFilter;
import com.modellifecycle.dto.ApiError;
import com.modellifecycle.dto.NoActionResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_ERROR", null, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations().stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more parameters failed validation", request, "VALIDATION_ERROR", null, fieldErrors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(err -> ApiError.FieldError.builder()
                    .field(result.getMethodParameter().getParameterName())
                    .rejectedValue(result.getArgument())
                    .message(err.getDefaultMessage())
                    .build()))
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more parameters failed validation", request, "VALIDATION_ERROR", null, fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "VALIDATION_ERROR", null, null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "VALIDATION_ERROR", null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body",
                     request, "VALIDATION_ERROR", null, null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            NotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler({
        LifecycleValidationException.class,
        DuplicateVersionException.class,
        ProtectedVersionException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(
            ModelLifecycleException ex, HttpServletRequest request) {
        log.info("Request rejected | code={} | message={}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler({NoRollbackTargetException.class, OutcomeAlreadyRecordedException.class})
    public ResponseEntity<ApiError> handleConflict(
            ModelLifecycleException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<NoActionResponse> handleInsufficientData(
            InsufficientDataException ex, HttpServletRequest request) {
        log.info("No action | reason={} | path={}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.ok(NoActionResponse.builder()
            .reason(ex.getMessage())
            .errorCode(ex.getErrorCode())
            .path(request.getRequestURI())
            .timestamp(clock.instant())
            .build());
    }

    @ExceptionHandler(TrainingFailedException.class)
    public ResponseEntity<ApiError> handleTrainingFailed(
            TrainingFailedException ex, HttpServletRequest request) {
        log.error("Training failed | decision={} | cause={}", ex.getDecisionId(), ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Training Failed", ex.getMessage(),
                     request, ex.getErrorCode(), ex.getDecisionId(), null);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiError> handleStorage(
            StorageException ex, HttpServletRequest request) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(MlApiUnavailableException.class)
    public ResponseEntity<ApiError> handleMlUnavailable(
            MlApiUnavailableException ex, HttpServletRequest request) {
        log.error("ML API unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "ML Service Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(MlApiException.class)
    public ResponseEntity<ApiError> handleMlError(
            MlApiException ex, HttpServletRequest request) {
        log.error("ML API error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "ML Service Error",
                     ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode, UUID decisionId,
            List<ApiError.FieldError> fieldErrors) {

        String requestId = MDC.get(RequestIdFilter.MDC_KEY);
        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId != null ? requestId : request.getHeader(RequestIdFilter.HEADER))
            .decisionId(decisionId)
            .timestamp(clock.instant())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
