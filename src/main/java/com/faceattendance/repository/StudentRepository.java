package com.faceattendance.repository;

import com.faceattendance.model.Student;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {

    Optional<Student> findByStudentId(String studentId);

    // duplicate check before enrollment; the unique keys still have the final word
    boolean existsByStudentIdOrAppId(String studentId, String appId);

    List<Student> findAllByOrderByNameAsc();
}
