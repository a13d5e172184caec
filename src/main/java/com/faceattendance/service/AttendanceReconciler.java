package com.faceattendance.service;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.config.ReadinessGate;
import com.faceattendance.exception.InputException;
import com.faceattendance.face.DetectedFace;
import com.faceattendance.face.DetectionMode;
import com.faceattendance.face.ExtractionOutcome;
import com.faceattendance.face.FaceExtractionFanOut;
import com.faceattendance.intake.ImageInput;
import com.faceattendance.matching.FaceMatcher;
import com.faceattendance.matching.MatchResult;
import com.faceattendance.matching.RosterDescriptorLoader;
import com.faceattendance.model.AttendanceStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides who attended a timetable slot from one or more class photos and
 * records a mark for every student on the roster.
 *
 * <p>Only roster students can be matched. Students not found in any photo are
 * marked absent, found ones present, so a rerun of the same slot overwrites the
 * previous result instead of adding to it.
 */
@Slf4j
@Service
public class AttendanceReconciler {

    private final RosterDescriptorLoader descriptorLoader;
    private final FaceExtractionFanOut extractionFanOut;
    private final AttendanceMarkStore markStore;
    private final ReadinessGate readinessGate;
    private final FaceAttendanceProperties props;

    public AttendanceReconciler(RosterDescriptorLoader descriptorLoader,
                                FaceExtractionFanOut extractionFanOut,
                                AttendanceMarkStore markStore,
                                ReadinessGate readinessGate,
                                FaceAttendanceProperties props) {
        this.descriptorLoader = descriptorLoader;
        this.extractionFanOut = extractionFanOut;
        this.markStore = markStore;
        this.readinessGate = readinessGate;
        this.props = props;
    }

    public AttendanceOutcome reconcile(String sessionKey, Collection<String> roster, List<ImageInput> images) {
        readinessGate.requireReady();

        if (sessionKey == null || sessionKey.isBlank()) {
            throw new InputException("timetable_id is required");
        }
        Set<String> rosterIds = normalizeRoster(roster);
        if (rosterIds.isEmpty()) {
            throw new InputException("student_ids must not be empty");
        }
        if (images == null || images.isEmpty()) {
            throw new InputException("At least one image is required");
        }

        FaceMatcher matcher = descriptorLoader.buildMatcher(rosterIds, props.getMatchThreshold());

        SortedSet<String> present = new TreeSet<>();
        int detections = 0;
        int unknownFaces = 0;
        int skippedImages = 0;

        if (matcher.isEmpty()) {
            log.warn("[Attendance] No valid student face descriptors found for timetable {}, marking roster absent",
                    sessionKey);
        } else {
            List<ExtractionOutcome> outcomes = extractionFanOut.extractAll(images, DetectionMode.ALL);
            for (ExtractionOutcome outcome : outcomes) {
                if (outcome.failed()) {
                    skippedImages++;
                    log.warn("[Attendance] Image load/detect failed for {}: {}",
                            outcome.sourceRef(), outcome.failure().getMessage());
                    continue;
                }
                ImageMatches matches = matchImage(matcher, outcome.faces(), rosterIds);
                detections += outcome.faces().size();
                unknownFaces += matches.unknownFaces();
                present.addAll(matches.students());
            }
        }

        SortedSet<String> absent = new TreeSet<>(rosterIds);
        absent.removeAll(present);

        // absent pass strictly before present pass
        markStore.upsert(sessionKey, absent, AttendanceStatus.ABSENT);
        markStore.upsert(sessionKey, present, AttendanceStatus.PRESENT);

        log.info("[Attendance] Done timetable {}: Present={}, Absent={}, Detections={}, Unknown={}, SkippedImages={}",
                sessionKey, present.size(), absent.size(), detections, unknownFaces, skippedImages);

        return new AttendanceOutcome(sessionKey,
                Collections.unmodifiableSortedSet(present),
                Collections.unmodifiableSortedSet(absent),
                detections, unknownFaces, skippedImages);
    }

    // one result set per image, merged by the caller
    private ImageMatches matchImage(FaceMatcher matcher, List<DetectedFace> faces, Set<String> rosterIds) {
        Set<String> matched = new HashSet<>();
        int unknown = 0;
        for (DetectedFace face : faces) {
            MatchResult result = matcher.classify(face.descriptor());
            if (result.isKnown() && rosterIds.contains(result.label())) {
                matched.add(result.label());
            } else {
                unknown++;
            }
        }
        return new ImageMatches(matched, unknown);
    }

    private static Set<String> normalizeRoster(Collection<String> roster) {
        Set<String> ids = new LinkedHashSet<>();
        if (roster == null) {
            return ids;
        }
        for (String id : roster) {
            if (id != null && !id.isBlank()) {
                ids.add(id.trim());
            }
        }
        return ids;
    }

    private record ImageMatches(Set<String> students, int unknownFaces) {
    }
}
