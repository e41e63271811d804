package com.commandhub;

/**
 * Failure categories surfaced to callers. Each maps to one HTTP status.
 */
public enum ErrorCode {
    UNKNOWN_COMMAND(400),
    MISSING_PROJECT_ID(400),
    NO_CREDENTIAL_CONFIGURED(400),
    VALIDATION_ERROR(400),
    UNAUTHORIZED(401),
    OPERATION_NOT_FOUND(404),
    NOT_PENDING_APPROVAL(409),
    NOT_UNDOABLE(409),
    ADAPTER_FAILURE(502),
    ADAPTER_TIMEOUT(504),
    STORAGE_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
