package com.branchsync.ingest.model;

import java.util.Locale;

public enum UserType {
    STUDENT,
    TEACHER,
    STAFF;

    /**
     * Lenient parse of directory role names; secretaries and admins clock in as staff.
     */
    public static UserType fromRole(String role) {
        if (role == null || role.isBlank()) {
            return STAFF;
        }
        return switch (role.trim().toLowerCase(Locale.ROOT)) {
            case "student" -> STUDENT;
            case "teacher" -> TEACHER;
            default -> STAFF;
        };
    }
}
