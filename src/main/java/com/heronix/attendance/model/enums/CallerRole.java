package com.heronix.attendance.model.enums;

/**
 * Role carried by the authenticated principal calling the engine.
 */
public enum CallerRole {
    INSTRUCTOR,
    STUDENT
}
