package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Exception thrown when a code is scanned after its session window closed.
 */
public class SessionExpiredException extends AttendanceException {

    private final Long sessionId;

    public SessionExpiredException(Long sessionId) {
        super(AttendanceErrorCode.EXPIRED, "Attendance session " + sessionId + " has expired");
        this.sessionId = sessionId;
    }

    public Long getSessionId() {
        return sessionId;
    }
}
