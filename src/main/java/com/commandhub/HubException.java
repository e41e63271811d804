package com.commandhub;

import com.commandhub.models.OperationStatus;

/**
 * Unchecked failure carrying an {@link ErrorCode}. Failures raised after an
 * Operation exists also carry its id, so callers can look the record up.
 */
public class HubException extends RuntimeException {

    private final ErrorCode code;
    private final Long operationId;
    private final OperationStatus currentStatus;

    public HubException(ErrorCode code, String message) {
        this(code, message, null, null, null);
    }

    public HubException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, null, cause);
    }

    private HubException(ErrorCode code, String message, Long operationId,
                         OperationStatus currentStatus, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.operationId = operationId;
        this.currentStatus = currentStatus;
    }

    public static HubException notPendingApproval(long operationId, OperationStatus current) {
        return new HubException(ErrorCode.NOT_PENDING_APPROVAL,
            "Operation " + operationId + " is not pending approval (status: " + current.wireName() + ")",
            operationId, current, null);
    }

    public HubException forOperation(long id, OperationStatus status) {
        return new HubException(code, getMessage(), id, status, getCause());
    }

    public ErrorCode getCode() {
        return code;
    }

    public Long getOperationId() {
        return operationId;
    }

    public OperationStatus getCurrentStatus() {
        return currentStatus;
    }
}
