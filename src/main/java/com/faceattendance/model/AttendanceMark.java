package com.faceattendance.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One student's status for one timetable slot. Upserted, never appended.
 */
@Entity
@Table(name = "ai_attendance", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"student_id", "timetable_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class AttendanceMark {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private String studentId;

    @Column(name = "timetable_id", nullable = false)
    private String sessionKey;

    @Convert(converter = AttendanceStatus.DbConverter.class)
    @Column(nullable = false)
    private AttendanceStatus status;

    public AttendanceMark(String studentId, String sessionKey, AttendanceStatus status) {
        this.studentId = studentId;
        this.sessionKey = sessionKey;
        this.status = status;
    }
}
