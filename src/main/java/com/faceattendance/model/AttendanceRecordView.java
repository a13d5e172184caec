package com.faceattendance.model;

public record AttendanceRecordView(Long id,
                                   AttendanceStatus status,
                                   Long studentPk,
                                   String name,
                                   String studentId,
                                   String appId) {
}
