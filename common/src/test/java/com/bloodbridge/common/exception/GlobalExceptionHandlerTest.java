package com.bloodbridge.common.exception;

import com.bloodbridge.common.dto.BaseResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Each domain failure maps to its own status and error code")
    void domainExceptions_mapToStatuses() {
        assertResponse(handler.handleResourceNotFoundException(new ResourceNotFoundException("User", 7L)),
                HttpStatus.NOT_FOUND, ResourceNotFoundException.CODE);
        assertResponse(handler.handleForbidden(new ForbiddenOperationException("not yours")),
                HttpStatus.FORBIDDEN, ForbiddenOperationException.CODE);
        assertResponse(handler.handleInvalidState(new InvalidStateException("already fulfilled")),
                HttpStatus.CONFLICT, InvalidStateException.CODE);
        assertResponse(handler.handleIneligibleDonor(new IneligibleDonorException("cooldown")),
                HttpStatus.UNPROCESSABLE_ENTITY, IneligibleDonorException.CODE);
        assertResponse(handler.handleValidationFailure(new ValidationFailureException("bad units")),
                HttpStatus.BAD_REQUEST, ValidationFailureException.CODE);
    }

    @Test
    void notFound_messageNamesTheResource() {
        ResponseEntity<BaseResponse<?>> response =
                handler.handleResourceNotFoundException(new ResourceNotFoundException("Donation", 42L));

        assertThat(response.getBody().getMessage()).isEqualTo("Donation with identifier 42 not found");
        assertThat(response.getBody().isSuccess()).isFalse();
    }

    @Test
    void optimisticLockConflict_isReportedAsInvalidState() {
        assertResponse(handler.handleOptimisticLock(new OptimisticLockingFailureException("stale version")),
                HttpStatus.CONFLICT, InvalidStateException.CODE);
    }

    @Test
    @DisplayName("Bean validation errors are returned per field")
    void beanValidation_collectsFieldErrors() throws NoSuchMethodException {
        BeanPropertyBindingResult result = new BeanPropertyBindingResult(new Object(), "request");
        result.addError(new FieldError("request", "unitsContributed", "Maximum 2 units can be contributed at once"));
        result.addError(new FieldError("request", "city", "City is required"));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("beanValidation_collectsFieldErrors"), -1);

        ResponseEntity<BaseResponse<Map<String, String>>> response =
                handler.handleValidationException(new MethodArgumentNotValidException(parameter, result));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getErrorCode()).isEqualTo(ValidationFailureException.CODE);
        assertThat(response.getBody().getData())
                .containsEntry("unitsContributed", "Maximum 2 units can be contributed at once")
                .containsEntry("city", "City is required");
    }

    @Test
    void unexpectedException_hidesDetails() {
        ResponseEntity<BaseResponse<?>> response = handler.handleGenericException(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).doesNotContain("boom");
        assertThat(response.getBody().getErrorCode()).isEqualTo("INTERNAL_ERROR");
    }

    private static void assertResponse(ResponseEntity<BaseResponse<?>> response, HttpStatus status, String code) {
        assertThat(response.getStatusCode()).isEqualTo(status);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getErrorCode()).isEqualTo(code);
    }
}
