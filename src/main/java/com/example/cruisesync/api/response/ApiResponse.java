package com.example.cruisesync.api.response;

import com.example.cruisesync.common.exception.BusinessException;
import com.example.cruisesync.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope for every endpoint. {@code code} is "0" on success; {@code traceId} echoes the
 * request id so a webhook delivery can be matched with its log lines.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, MDC.get(AccessLogFilter.MDC_REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return fail(code, message, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction) {
        return new ApiResponse<>(code, message, null, userAction, MDC.get(AccessLogFilter.MDC_REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return fail(e.getCode(), e.getMessage(), e.getUserAction());
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return fail(BusinessException.NOT_FOUND, message);
    }
}
