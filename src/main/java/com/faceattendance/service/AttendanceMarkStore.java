package com.faceattendance.service;

import com.faceattendance.exception.StoreException;
import com.faceattendance.model.AttendanceMark;
import com.faceattendance.model.AttendanceStatus;
import com.faceattendance.repository.AttendanceMarkRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Insert-or-update of attendance marks, keyed by (student, session).
 */
@Component
public class AttendanceMarkStore {

    private final AttendanceMarkRepository markRepository;

    public AttendanceMarkStore(AttendanceMarkRepository markRepository) {
        this.markRepository = markRepository;
    }

    /**
     * Sets {@code status} for every listed student in the session. Marks that
     * already carry the status are left alone.
     *
     * @return how many marks were inserted or changed
     */
    @Transactional
    public int upsert(String sessionKey, Collection<String> studentIds, AttendanceStatus status) {
        if (studentIds.isEmpty()) {
            return 0;
        }
        Set<String> ids = new LinkedHashSet<>(studentIds);
        try {
            Map<String, AttendanceMark> existing = markRepository
                    .findBySessionKeyAndStudentIdIn(sessionKey, ids)
                    .stream()
                    .collect(Collectors.toMap(AttendanceMark::getStudentId, Function.identity()));

            List<AttendanceMark> changed = new ArrayList<>();
            for (String studentId : ids) {
                AttendanceMark mark = existing.get(studentId);
                if (mark == null) {
                    changed.add(new AttendanceMark(studentId, sessionKey, status));
                } else if (mark.getStatus() != status) {
                    mark.setStatus(status);
                    changed.add(mark);
                }
            }

            markRepository.saveAll(changed);
            markRepository.flush();
            return changed.size();
        } catch (DataAccessException e) {
            throw new StoreException("Could not record attendance for timetable " + sessionKey + ": " + e.getMessage(), e);
        }
    }
}
