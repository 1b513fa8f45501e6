package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.AttendanceErrorCode;

/**
 * Exception thrown when the session store cannot be reached.
 * Callers should retry with backoff.
 */
public class StoreUnavailableException extends AttendanceException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(AttendanceErrorCode.UNAVAILABLE, message, cause);
    }
}
