package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Exception thrown when a code collides on insert or a mark keeps losing
 * races after the retry budget is spent.
 */
public class SessionConflictException extends AttendanceException {

    public SessionConflictException(String message) {
        super(AttendanceErrorCode.CONFLICT, message);
    }

    public SessionConflictException(String message, Throwable cause) {
        super(AttendanceErrorCode.CONFLICT, message, cause);
    }
}
