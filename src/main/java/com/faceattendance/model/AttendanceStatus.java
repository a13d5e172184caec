package com.faceattendance.model;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;

public enum AttendanceStatus {
    PRESENT("Present"),
    ABSENT("Absent");

    private final String dbValue;

    AttendanceStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    public static AttendanceStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown attendance status: " + value));
    }

    /** Stores the statuses the way the attendance table spells them. */
    @Converter(autoApply = true)
    public static class DbConverter implements AttributeConverter<AttendanceStatus, String> {

        @Override
        public String convertToDatabaseColumn(AttendanceStatus status) {
            return status == null ? null : status.getDbValue();
        }

        @Override
        public AttendanceStatus convertToEntityAttribute(String value) {
            return value == null ? null : fromDbValue(value);
        }
    }
}
