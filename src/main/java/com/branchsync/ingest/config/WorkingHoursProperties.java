package com.branchsync.ingest.config;

import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.model.WorkingHours;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Expected working windows per user type, keyed by lower-case type name
 * ({@code student}, {@code teacher}, {@code staff}).
 */
@ConfigurationProperties(prefix = "working-hours")
public class WorkingHoursProperties {
    private Map<String, Window> types = new LinkedHashMap<>();

    public Map<String, Window> getTypes() {
        return types;
    }

    public void setTypes(Map<String, Window> types) {
        if (types == null) {
            this.types = new LinkedHashMap<>();
            return;
        }
        this.types = new LinkedHashMap<>(types);
    }

    public Map<UserType, WorkingHours> toWorkingHours() {
        Map<UserType, WorkingHours> result = new EnumMap<>(UserType.class);
        types.forEach((key, window) -> {
            UserType type = UserType.valueOf(key.trim().toUpperCase(Locale.ROOT));
            result.put(type, new WorkingHours(LocalTime.parse(window.getStart()), LocalTime.parse(window.getEnd()),
                    window.getGraceMinutes()));
        });
        return result;
    }

    public static class Window {
        // HH:mm, quoted in YAML so it is not read as a base-60 number
        private String start;
        private String end;
        private int graceMinutes;

        public String getStart() {
            return start;
        }

        public void setStart(String start) {
            this.start = start;
        }

        public String getEnd() {
            return end;
        }

        public void setEnd(String end) {
            this.end = end;
        }

        public int getGraceMinutes() {
            return graceMinutes;
        }

        public void setGraceMinutes(int graceMinutes) {
            this.graceMinutes = graceMinutes;
        }
    }
}
