package com.bloodbridge.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope returned by every BloodBridge endpoint.
 * Successful calls carry {@code data}; failures carry {@code errorCode} and, for
 * validation failures, a field-to-message map in {@code data}.
 *
 * @param <T> Type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private boolean success;
    private String message;
    private T data;
    private Instant timestamp;
    private String errorCode;

    public static <T> BaseResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return BaseResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> BaseResponse<T> error(String message, String errorCode) {
        return error(message, errorCode, null);
    }

    public static <T> BaseResponse<T> error(String message, String errorCode, T details) {
        return BaseResponse.<T>builder()
                .success(false)
                .message(message)
                .errorCode(errorCode)
                .data(details)
                .timestamp(Instant.now())
                .build();
    }
}
