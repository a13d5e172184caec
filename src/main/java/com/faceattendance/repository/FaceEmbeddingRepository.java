package com.faceattendance.repository;

import com.faceattendance.model.FaceEmbedding;
import com.faceattendance.model.StoredDescriptor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface FaceEmbeddingRepository extends JpaRepository<FaceEmbedding, Long> {

    @Query("select new com.faceattendance.model.StoredDescriptor(s.studentId, e.faceDescriptor) "
            + "from FaceEmbedding e join e.student s "
            + "where s.studentId in :studentIds "
            + "order by s.studentId, e.id")
    List<StoredDescriptor> findDescriptorsByStudentIds(@Param("studentIds") Collection<String> studentIds);

    long countByStudentStudentId(String studentId);
}
