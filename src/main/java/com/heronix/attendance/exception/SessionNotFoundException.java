package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Exception thrown when a scanned code or a session id does not resolve.
 */
public class SessionNotFoundException extends AttendanceException {

    private final String userMessage;

    private SessionNotFoundException(String message, String userMessage) {
        super(AttendanceErrorCode.NOT_FOUND, message);
        this.userMessage = userMessage;
    }

    public static SessionNotFoundException forCode(String code) {
        return new SessionNotFoundException("No attendance session for code: " + code, "invalid code");
    }

    public static SessionNotFoundException forId(Long sessionId) {
        return new SessionNotFoundException("Attendance session not found: " + sessionId, "session not found");
    }

    @Override
    public String getUserMessage() {
        return userMessage;
    }
}
