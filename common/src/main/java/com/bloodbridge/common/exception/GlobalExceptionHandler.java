package com.bloodbridge.common.exception;

import com.bloodbridge.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the domain exception taxonomy onto HTTP statuses and the {@link BaseResponse} envelope.
 * This is the only place where failures are formatted for clients.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<BaseResponse<?>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<BaseResponse<?>> handleForbidden(ForbiddenOperationException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidState(InvalidStateException ex) {
        log.info("Rejected state transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(IneligibleDonorException.class)
    public ResponseEntity<BaseResponse<?>> handleIneligibleDonor(IneligibleDonorException ex) {
        log.info("Ineligible donor: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(ValidationFailureException.class)
    public ResponseEntity<BaseResponse<?>> handleValidationFailure(ValidationFailureException ex) {
        log.warn("Validation failure: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<BaseResponse<?>> handleBusinessException(BusinessException ex) {
        log.error("Business exception occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<BaseResponse<?>> handleOptimisticLock(OptimisticLockingFailureException ex) {
        log.info("Concurrent modification detected: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error(
                "The record was modified concurrently. Reload and retry.", InvalidStateException.CODE);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<BaseResponse<Map<String, String>>> handleValidationException(
            MethodArgumentNotValidException ex) {
        log.warn("Validation exception: {}", ex.getMessage());
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fe ? fe.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        BaseResponse<Map<String, String>> response = BaseResponse.error(
                "Validation failed", ValidationFailureException.CODE, errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<BaseResponse<?>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error(ex.getMessage(), ValidationFailureException.CODE);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BaseResponse<?>> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        BaseResponse<?> response = BaseResponse.error(
                "An unexpected error occurred", "INTERNAL_ERROR");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<BaseResponse<?>> respond(HttpStatus status, BusinessException ex) {
        BaseResponse<?> response = BaseResponse.error(ex.getMessage(), ex.getErrorCode());
        return ResponseEntity.status(status).body(response);
    }
}
