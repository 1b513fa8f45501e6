package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Base class for the expected, typed failures of the attendance engine.
 */
public abstract class AttendanceException extends RuntimeException {

    private final AttendanceErrorCode errorCode;

    protected AttendanceException(AttendanceErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AttendanceException(AttendanceErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public AttendanceErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Text safe to show to the end user.
     */
    public String getUserMessage() {
        return errorCode.getUserMessage();
    }
}
