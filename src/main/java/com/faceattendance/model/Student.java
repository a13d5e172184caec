package com.faceattendance.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * An enrolled person. Written once by a successful enrollment, read-only afterwards.
 */
@Entity
@Table(name = "ai_students")
@Getter
@NoArgsConstructor
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, unique = true)
    private String studentId;

    @Column(name = "app_id", nullable = false, unique = true)
    private String appId;

    @Column(nullable = false)
    private String name;

    public Student(String studentId, String appId, String name) {
        this.studentId = studentId;
        this.appId = appId;
        this.name = name;
    }
}
