package com.faceattendance.controller;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.exception.ImageFetchException;
import com.faceattendance.exception.InputException;
import com.faceattendance.intake.ImageFetcher;
import com.faceattendance.intake.ImageInput;
import com.faceattendance.repository.AttendanceMarkRepository;
import com.faceattendance.service.AttendanceJobRunner;
import com.faceattendance.service.AttendanceOutcome;
import com.faceattendance.service.AttendanceReconciler;
import com.faceattendance.service.JobAcknowledgement;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

@RestController
@CrossOrigin(origins = "*")
public class AttendanceController {

    private final AttendanceReconciler reconciler;
    private final AttendanceJobRunner jobRunner;
    private final ImageFetcher imageFetcher;
    private final AttendanceMarkRepository markRepository;
    private final FaceAttendanceProperties props;

    public AttendanceController(AttendanceReconciler reconciler,
                                AttendanceJobRunner jobRunner,
                                ImageFetcher imageFetcher,
                                AttendanceMarkRepository markRepository,
                                FaceAttendanceProperties props) {
        this.reconciler = reconciler;
        this.jobRunner = jobRunner;
        this.imageFetcher = imageFetcher;
        this.markRepository = markRepository;
        this.props = props;
    }

    // Class attendance from uploaded photos
    @PostMapping(path = "/class/attendance", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AttendanceResponse> classAttendance(
            @RequestParam MultiValueMap<String, String> form,
            @RequestParam(value = "images", required = false) List<MultipartFile> files
    ) {
        String timetableId = form.getFirst("timetable_id");
        List<String> studentIds = RequestLists.flatten(form.get("student_ids"), "student_ids");
        List<UploadedImages.Upload> uploads = UploadedImages.read(files);

        if (isBlank(timetableId) || studentIds.isEmpty() || uploads.isEmpty()) {
            throw new InputException("timetable_id, student_ids, and images required");
        }
        int max = props.getAttendance().getMaxUploadImages();
        if (uploads.size() > max) {
            throw new InputException("At most " + max + " images are allowed");
        }

        List<ImageInput> images = new ArrayList<>(uploads.size());
        for (UploadedImages.Upload upload : uploads) {
            images.add(new ImageInput(upload.originalName(), upload.bytes()));
        }

        AttendanceOutcome outcome = reconciler.reconcile(timetableId, studentIds, images);
        return ResponseEntity.ok(AttendanceResponse.of("Attendance processed", outcome));
    }

    // Class attendance from image URLs, answered once processing is done
    @PostMapping(path = "/class/attendance-url", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AttendanceResponse> classAttendanceByUrl(@RequestBody AttendanceByUrlRequest request) {
        List<String> studentIds = RequestLists.flatten(request.studentIds(), "student_ids");
        List<String> urls = RequestLists.flatten(request.imageUrls(), "image_urls");
        if (isBlank(request.timetableId()) || studentIds.isEmpty() || urls.isEmpty()) {
            throw new InputException("timetable_id, student_ids, image_urls required");
        }

        List<ImageInput> images = imageFetcher.fetchAvailable(urls);
        if (images.isEmpty()) {
            throw new ImageFetchException("None of the images could be downloaded");
        }

        AttendanceOutcome outcome = reconciler.reconcile(request.timetableId(), studentIds, images);
        return ResponseEntity.ok(AttendanceResponse.of("Attendance processed via URLs", outcome));
    }

    // Same as above, but acknowledged immediately and processed in the background
    @PostMapping(path = "/api/attendance-by-url", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobAcknowledgement> attendanceByUrlAsync(@RequestBody AttendanceByUrlRequest request) {
        List<String> studentIds = RequestLists.flatten(request.studentIds(), "student_ids");
        List<String> urls = RequestLists.flatten(request.imageUrls(), "image_urls");
        return ResponseEntity.ok(jobRunner.submit(request.timetableId(), studentIds, urls));
    }

    @GetMapping("/attendance")
    public ResponseEntity<SessionAttendance> attendance(
            @RequestParam(value = "timetable_id", required = false) String timetableId
    ) {
        if (isBlank(timetableId)) {
            throw new InputException("timetable_id required");
        }
        return ResponseEntity.ok(new SessionAttendance(timetableId, markRepository.findRecordsForSession(timetableId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
