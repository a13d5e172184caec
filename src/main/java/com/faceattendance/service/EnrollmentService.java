package com.faceattendance.service;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.config.ReadinessGate;
import com.faceattendance.exception.ConflictException;
import com.faceattendance.exception.InputException;
import com.faceattendance.exception.StoreException;
import com.faceattendance.exception.ValidationException;
import com.faceattendance.face.DetectedFace;
import com.faceattendance.face.DetectionMode;
import com.faceattendance.face.ExtractionOutcome;
import com.faceattendance.face.FaceDistance;
import com.faceattendance.face.FaceExtractionFanOut;
import com.faceattendance.model.Student;
import com.faceattendance.repository.StudentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns enrollment photos into a stored student with one embedding per photo.
 *
 * <p>Order of checks:
 * <ol>
 *   <li>required fields and photo count</li>
 *   <li>student id / app id not taken</li>
 *   <li>every photo yields a face (exactly one in strict mode)</li>
 *   <li>all photos are within the match threshold of each other</li>
 * </ol>
 * Only then is anything written, in a single transaction.
 */
@Slf4j
@Service
public class EnrollmentService {

    private final StudentRepository studentRepository;
    private final FaceExtractionFanOut extractionFanOut;
    private final StudentRegistrar registrar;
    private final ReadinessGate readinessGate;
    private final FaceAttendanceProperties props;

    public EnrollmentService(StudentRepository studentRepository,
                             FaceExtractionFanOut extractionFanOut,
                             StudentRegistrar registrar,
                             ReadinessGate readinessGate,
                             FaceAttendanceProperties props) {
        this.studentRepository = studentRepository;
        this.extractionFanOut = extractionFanOut;
        this.registrar = registrar;
        this.readinessGate = readinessGate;
        this.props = props;
    }

    public EnrollmentResult enroll(EnrollmentRequest request) {
        readinessGate.requireReady();

        String studentId = required(request.studentId(), "student_id");
        String appId = required(request.appId(), "app_id");
        String name = required(request.name(), "name");

        int expected = props.getEnrollment().getImageCount();
        if (request.images().size() != expected) {
            throw new InputException("Exactly " + expected + " images are required");
        }

        ensureNotEnrolled(studentId, appId);

        boolean strict = props.getEnrollment().isRequireSingleFace();
        List<ExtractionOutcome> outcomes = extractionFanOut.extractAll(
                request.images(), strict ? DetectionMode.ALL : DetectionMode.SINGLE);

        List<EnrolledImage> images = new ArrayList<>(outcomes.size());
        for (ExtractionOutcome outcome : outcomes) {
            images.add(new EnrolledImage(outcome.sourceRef(), pickFace(outcome, strict).descriptor()));
        }

        double maxDistance = maxPairDistance(images);
        if (maxDistance > props.getMatchThreshold()) {
            log.info("Enrollment of {} rejected, photos differ by {}", studentId, maxDistance);
            throw new ValidationException("Images are not of the same person");
        }

        Student student = registrar.register(studentId, appId, name, images);
        log.info("Student registered: {} ({}) with {} embeddings", studentId, name, images.size());

        return new EnrollmentResult(student.getId(), studentId, appId, name, images.size(), maxDistance);
    }

    private void ensureNotEnrolled(String studentId, String appId) {
        boolean taken;
        try {
            taken = studentRepository.existsByStudentIdOrAppId(studentId, appId);
        } catch (DataAccessException e) {
            throw new StoreException("Could not check for existing student: " + e.getMessage(), e);
        }
        if (taken) {
            throw new ConflictException("Duplicate student_id or app_id");
        }
    }

    private DetectedFace pickFace(ExtractionOutcome outcome, boolean strict) {
        if (outcome.failed()) {
            throw outcome.failure();
        }
        List<DetectedFace> faces = outcome.faces();
        if (faces.isEmpty()) {
            throw new ValidationException("No face detected in image " + (outcome.index() + 1), outcome.index());
        }
        if (strict && faces.size() > 1) {
            throw new ValidationException("Multiple faces detected in image " + (outcome.index() + 1), outcome.index());
        }
        return faces.stream().max(Comparator.comparingDouble(DetectedFace::score)).orElseThrow();
    }

    // all pairs, not just first-vs-rest
    static double maxPairDistance(List<EnrolledImage> images) {
        double max = 0;
        for (int i = 0; i < images.size(); i++) {
            for (int j = i + 1; j < images.size(); j++) {
                max = Math.max(max, FaceDistance.euclidean(images.get(i).descriptor(), images.get(j).descriptor()));
            }
        }
        return max;
    }

    private static String required(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new InputException(field + " is required");
        }
        return value.trim();
    }
}
