package com.heronix.attendance.model.enums;

/**
 * Typed outcomes of engine operations, each with the phrase shown to the user.
 */
public enum AttendanceErrorCode {

    NOT_FOUND("invalid code"),
    EXPIRED("code expired"),
    ALREADY_MARKED("already marked"),
    CONFLICT("try again"),
    FORBIDDEN("not authorized"),
    UNAVAILABLE("service unavailable");

    private final String userMessage;

    AttendanceErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
