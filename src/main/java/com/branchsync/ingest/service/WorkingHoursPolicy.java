package com.branchsync.ingest.service;

import com.branchsync.ingest.config.WorkingHoursProperties;
import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.model.WorkingHours;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Expected working window per user type. Types missing from configuration fall back
 * to the built-in defaults.
 */
@Component
public class WorkingHoursPolicy {
    private static final Map<UserType, WorkingHours> DEFAULTS = Map.of(
            UserType.STUDENT, new WorkingHours(LocalTime.of(8, 0), LocalTime.of(16, 0), 10),
            UserType.TEACHER, new WorkingHours(LocalTime.of(7, 30), LocalTime.of(16, 30), 10),
            UserType.STAFF, new WorkingHours(LocalTime.of(8, 0), LocalTime.of(17, 0), 15)
    );

    private final Map<UserType, WorkingHours> hours;

    public WorkingHoursPolicy(Map<UserType, WorkingHours> configured) {
        Map<UserType, WorkingHours> merged = new EnumMap<>(DEFAULTS);
        if (configured != null) {
            merged.putAll(configured);
        }
        this.hours = merged;
    }

    @Autowired
    public WorkingHoursPolicy(WorkingHoursProperties properties) {
        this(properties.toWorkingHours());
    }

    public static WorkingHoursPolicy defaults() {
        return new WorkingHoursPolicy(Map.of());
    }

    public WorkingHours forUserType(UserType userType) {
        return hours.get(userType);
    }
}
