package com.faceattendance.service;

import com.faceattendance.exception.ConflictException;
import com.faceattendance.exception.StoreException;
import com.faceattendance.matching.DescriptorCodec;
import com.faceattendance.model.FaceEmbedding;
import com.faceattendance.model.Student;
import com.faceattendance.repository.FaceEmbeddingRepository;
import com.faceattendance.repository.StudentRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a student together with all of its embeddings in one transaction,
 * so a half-enrolled student is never visible.
 */
@Component
public class StudentRegistrar {

    private final StudentRepository studentRepository;
    private final FaceEmbeddingRepository embeddingRepository;
    private final DescriptorCodec codec;

    public StudentRegistrar(StudentRepository studentRepository,
                            FaceEmbeddingRepository embeddingRepository,
                            DescriptorCodec codec) {
        this.studentRepository = studentRepository;
        this.embeddingRepository = embeddingRepository;
        this.codec = codec;
    }

    @Transactional
    public Student register(String studentId, String appId, String name, List<EnrolledImage> images) {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("A student needs at least one embedding");
        }
        try {
            if (studentRepository.existsByStudentIdOrAppId(studentId, appId)) {
                throw new ConflictException("Duplicate student_id or app_id");
            }

            Student student = studentRepository.save(new Student(studentId, appId, name));

            List<FaceEmbedding> embeddings = new ArrayList<>(images.size());
            for (EnrolledImage image : images) {
                embeddings.add(new FaceEmbedding(student, image.sourceRef(), codec.encode(image.descriptor())));
            }
            embeddingRepository.saveAll(embeddings);
            embeddingRepository.flush();
            return student;
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent enrollment with the same keys
            throw new ConflictException("Duplicate student_id or app_id", e);
        } catch (DataAccessException e) {
            throw new StoreException("Could not save student " + studentId + ": " + e.getMessage(), e);
        }
    }
}
