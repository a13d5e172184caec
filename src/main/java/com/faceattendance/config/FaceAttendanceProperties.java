package com.faceattendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bound to application.properties under the "face" prefix.
 *
 * face.match-threshold=0.6
 * face.extractor.base-url=http://localhost:8000
 * face.enrollment.require-single-face=false
 */
@Data
@ConfigurationProperties(prefix = "face")
public class FaceAttendanceProperties {

    /** Maximum Euclidean distance at which two descriptors belong to the same person. */
    private double matchThreshold = 0.6;

    /** Length of every descriptor the embedding model produces. */
    private int descriptorLength = 128;

    private Enrollment enrollment = new Enrollment();
    private Extractor extractor = new Extractor();
    private Intake intake = new Intake();
    private Storage storage = new Storage();
    private Attendance attendance = new Attendance();
    private Executor executor = new Executor();
    private Startup startup = new Startup();

    @Data
    public static class Enrollment {
        private int imageCount = 3;
        /** Reject enrollment photos showing more than one face. */
        private boolean requireSingleFace = false;
    }

    @Data
    public static class Extractor {
        private String baseUrl = "http://localhost:8000";
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** Deadline for a single detection call. */
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Intake {
        private Duration downloadTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Storage {
        private String uploadRoot = "uploads";
    }

    @Data
    public static class Attendance {
        private int maxUploadImages = 5;
    }

    @Data
    public static class Executor {
        private int taskPoolSize = 8;
        private int jobPoolSize = 2;
        private int jobQueueCapacity = 100;
    }

    @Data
    public static class Startup {
        private boolean verifyDependencies = true;
    }
}
