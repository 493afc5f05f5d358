package com.example.cruisesync.common.exception;

/**
 * Request-level failure with a code the client can act on. The code travels in the
 * {@code ApiResponse} body.
 */
public class BusinessException extends RuntimeException {

    public static final String BAD_REQUEST = "400";
    public static final String NOT_FOUND = "404";
    public static final String CONFLICT = "409";

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public static BusinessException badRequest(String message) {
        return new BusinessException(BAD_REQUEST, message);
    }

    public static BusinessException notFound(String message) {
        return new BusinessException(NOT_FOUND, message);
    }

    /** Another run owns the resource; retrying after it finishes is expected to work. */
    public static BusinessException conflict(String message) {
        return new BusinessException(CONFLICT, message, "Retry after the active sync finishes");
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    public boolean isConflict() {
        return CONFLICT.equals(code);
    }
}
