package com.heronix.attendance.model.enums;

/**
 * Status of an attendance session.
 */
public enum SessionStatus {

    /**
     * Session is open and accepts scans until its window elapses
     */
    ACTIVE,

    /**
     * Window elapsed or the owner closed the session. Terminal.
     */
    EXPIRED
}
