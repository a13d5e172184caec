package com.faceattendance.service;

import com.faceattendance.config.FaceAttendanceConfig;
import com.faceattendance.config.ReadinessGate;
import com.faceattendance.exception.InputException;
import com.faceattendance.exception.StoreException;
import com.faceattendance.intake.ImageFetcher;
import com.faceattendance.intake.ImageInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Accepts attendance requests by image URL and processes them off the request thread.
 *
 * <p>Downloads and model inference can outlast an HTTP timeout, so the caller only
 * gets an acknowledgement with counts. The result shows up in the attendance
 * table; failures only in the log.
 */
@Slf4j
@Service
public class AttendanceJobRunner {

    private static final String ACCEPTED_MESSAGE = "Attendance request received. Processing in background.";

    private final Executor executor;
    private final ImageFetcher imageFetcher;
    private final AttendanceReconciler reconciler;
    private final ReadinessGate readinessGate;

    public AttendanceJobRunner(@Qualifier(FaceAttendanceConfig.ATTENDANCE_JOB_EXECUTOR) Executor executor,
                               ImageFetcher imageFetcher,
                               AttendanceReconciler reconciler,
                               ReadinessGate readinessGate) {
        this.executor = executor;
        this.imageFetcher = imageFetcher;
        this.reconciler = reconciler;
        this.readinessGate = readinessGate;
    }

    /**
     * @throws InputException if the slot, roster or image list is missing
     * @throws org.springframework.core.task.TaskRejectedException if the job queue is full
     */
    public JobAcknowledgement submit(String sessionKey, List<String> roster, List<String> imageUrls) {
        readinessGate.requireReady();

        if (sessionKey == null || sessionKey.isBlank()
                || roster == null || roster.isEmpty()
                || imageUrls == null || imageUrls.isEmpty()) {
            throw new InputException("timetable_id, student_ids, image_urls required");
        }

        List<String> rosterCopy = List.copyOf(roster);
        List<String> urlsCopy = List.copyOf(imageUrls);
        executor.execute(() -> process(sessionKey, rosterCopy, urlsCopy));

        return new JobAcknowledgement(ACCEPTED_MESSAGE, sessionKey, rosterCopy.size(), urlsCopy.size());
    }

    void process(String sessionKey, List<String> roster, List<String> imageUrls) {
        log.info("[Attendance] Start timetable {} ({} students, {} images)...",
                sessionKey, roster.size(), imageUrls.size());
        try {
            List<ImageInput> images = imageFetcher.fetchAvailable(imageUrls);
            if (images.isEmpty()) {
                // a total download outage must not mark the whole roster absent
                log.error("[Attendance] No images could be downloaded for timetable {}, nothing recorded", sessionKey);
                return;
            }
            reconciler.reconcile(sessionKey, roster, images);
        } catch (StoreException e) {
            log.error("[Attendance] Processing error for timetable {}, run aborted: {}", sessionKey, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("[Attendance] Processing error for timetable {}", sessionKey, e);
        }
    }
}
