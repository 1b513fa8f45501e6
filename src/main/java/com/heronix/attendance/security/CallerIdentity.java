package com.heronix.attendance.security;

import com.heronix.attendance.model.enums.CallerRole;

/**
 * Authenticated principal handed to the engine by the identity layer.
 */
public record CallerIdentity(String id, CallerRole role, String name, String email) {

    /**
     * Longest principal id the store keeps (student id and profile key columns).
     */
    public static final int MAX_ID_LENGTH = 64;

    public static final int MAX_NAME_LENGTH = 200;

    public static final int MAX_EMAIL_LENGTH = 254;

    public CallerIdentity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Caller id is required");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException("Caller id must be at most " + MAX_ID_LENGTH + " characters");
        }
        if (role == null) {
            throw new IllegalArgumentException("Caller role is required");
        }
        if (name != null && name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Caller name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (email != null && email.length() > MAX_EMAIL_LENGTH) {
            throw new IllegalArgumentException("Caller email must be at most " + MAX_EMAIL_LENGTH + " characters");
        }
    }

    public static CallerIdentity instructor(String id, String name, String email) {
        return new CallerIdentity(id, CallerRole.INSTRUCTOR, name, email);
    }

    public static CallerIdentity student(String id, String name, String email) {
        return new CallerIdentity(id, CallerRole.STUDENT, name, email);
    }

    public boolean hasRole(CallerRole expected) {
        return role == expected;
    }
}
