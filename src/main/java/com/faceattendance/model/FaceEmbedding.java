package com.faceattendance.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "ai_student_images")
@Getter
@NoArgsConstructor
public class FaceEmbedding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false)
    private Student student;

    @Column(name = "image_path")
    private String imagePath;

    // JSON array kept as LONGTEXT (no LOB streaming)
    @Column(name = "face_descriptor", nullable = false, columnDefinition = "LONGTEXT")
    private String faceDescriptor;

    public FaceEmbedding(Student student, String imagePath, String faceDescriptor) {
        this.student = student;
        this.imagePath = imagePath;
        this.faceDescriptor = faceDescriptor;
    }
}
