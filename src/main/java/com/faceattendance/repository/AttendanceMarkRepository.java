package com.faceattendance.repository;

import com.faceattendance.model.AttendanceMark;
import com.faceattendance.model.AttendanceRecordView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AttendanceMarkRepository extends JpaRepository<AttendanceMark, Long> {

    List<AttendanceMark> findBySessionKeyAndStudentIdIn(String sessionKey, Collection<String> studentIds);

    List<AttendanceMark> findBySessionKey(String sessionKey);

    @Query("select new com.faceattendance.model.AttendanceRecordView(m.id, m.status, s.id, s.name, s.studentId, s.appId) "
            + "from AttendanceMark m join Student s on s.studentId = m.studentId "
            + "where m.sessionKey = :sessionKey "
            + "order by s.name")
    List<AttendanceRecordView> findRecordsForSession(@Param("sessionKey") String sessionKey);
}
