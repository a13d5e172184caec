package com.faceattendance.matching;

import com.faceattendance.exception.StoreException;
import com.faceattendance.model.StoredDescriptor;
import com.faceattendance.repository.FaceEmbeddingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the stored descriptors of a roster and groups them by student id,
 * which is the shape {@link FaceMatcher#of} takes.
 */
@Slf4j
@Component
public class RosterDescriptorLoader {

    private final FaceEmbeddingRepository embeddingRepository;
    private final DescriptorCodec codec;

    public RosterDescriptorLoader(FaceEmbeddingRepository embeddingRepository, DescriptorCodec codec) {
        this.embeddingRepository = embeddingRepository;
        this.codec = codec;
    }

    /**
     * Corrupt rows are skipped with a warning; students whose rows are all
     * corrupt are simply absent from the result.
     */
    public Map<String, List<float[]>> load(Collection<String> studentIds) {
        if (studentIds.isEmpty()) {
            return Map.of();
        }

        List<StoredDescriptor> rows;
        try {
            rows = embeddingRepository.findDescriptorsByStudentIds(studentIds);
        } catch (DataAccessException e) {
            throw new StoreException("Could not load face descriptors: " + e.getMessage(), e);
        }

        Map<String, List<float[]>> grouped = new LinkedHashMap<>();
        int skipped = 0;
        for (StoredDescriptor row : rows) {
            try {
                float[] descriptor = codec.decode(row.faceDescriptor());
                grouped.computeIfAbsent(row.studentId(), k -> new ArrayList<>()).add(descriptor);
            } catch (InvalidDescriptorException e) {
                skipped++;
                log.warn("Invalid descriptor for student {}: {}", row.studentId(), e.getMessage());
            }
        }

        log.debug("Loaded {} descriptors for {} of {} students ({} skipped)",
                rows.size() - skipped, grouped.size(), studentIds.size(), skipped);
        return grouped;
    }

    public FaceMatcher buildMatcher(Collection<String> studentIds, double threshold) {
        return FaceMatcher.of(load(studentIds), threshold);
    }
}
