package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Raised when the student is already counted for the session. Nothing was changed.
 */
public class AlreadyMarkedException extends AttendanceException {

    private final Long sessionId;
    private final String studentId;

    public AlreadyMarkedException(Long sessionId, String studentId) {
        super(AttendanceErrorCode.ALREADY_MARKED,
                "Student " + studentId + " already marked for session " + sessionId);
        this.sessionId = sessionId;
        this.studentId = studentId;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public String getStudentId() {
        return studentId;
    }
}
