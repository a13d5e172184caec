package com.faceattendance.config;

import com.faceattendance.face.FaceEmbeddingExtractor;
import com.faceattendance.repository.StudentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Verifies the embedding service and the store once at startup, then opens the
 * {@link ReadinessGate}. A failure here aborts application startup.
 */
@Slf4j
@Component
public class FaceEngineInitializer implements ApplicationRunner {

    private final FaceEmbeddingExtractor extractor;
    private final StudentRepository studentRepository;
    private final ReadinessGate readinessGate;
    private final FaceAttendanceProperties props;

    public FaceEngineInitializer(FaceEmbeddingExtractor extractor,
                                 StudentRepository studentRepository,
                                 ReadinessGate readinessGate,
                                 FaceAttendanceProperties props) {
        this.extractor = extractor;
        this.studentRepository = studentRepository;
        this.readinessGate = readinessGate;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.getStartup().isVerifyDependencies()) {
            log.warn("Dependency verification disabled, opening readiness gate without checks");
            readinessGate.markReady();
            return;
        }

        try {
            log.info("Checking face embedding service at {}", props.getExtractor().getBaseUrl());
            extractor.checkHealth();

            long enrolled = studentRepository.count();
            log.info("Database reachable, {} students enrolled", enrolled);
        } catch (RuntimeException e) {
            log.error("Fatal init error: {}", e.getMessage(), e);
            throw new IllegalStateException("Face attendance dependencies are not available", e);
        }

        readinessGate.markReady();
        log.info("Face attendance service ready (match threshold {})", props.getMatchThreshold());
    }
}
