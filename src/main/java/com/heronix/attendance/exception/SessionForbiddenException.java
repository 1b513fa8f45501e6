package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Exception thrown when the caller does not own the session or lacks the role.
 */
public class SessionForbiddenException extends AttendanceException {

    public SessionForbiddenException(String message) {
        super(AttendanceErrorCode.FORBIDDEN, message);
    }
}
