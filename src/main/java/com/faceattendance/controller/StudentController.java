package com.faceattendance.controller;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.exception.FaceAttendanceException;
import com.faceattendance.exception.InputException;
import com.faceattendance.intake.ImageArchive;
import com.faceattendance.intake.ImageFetcher;
import com.faceattendance.intake.ImageInput;
import com.faceattendance.model.Student;
import com.faceattendance.repository.StudentRepository;
import com.faceattendance.service.EnrollmentRequest;
import com.faceattendance.service.EnrollmentResult;
import com.faceattendance.service.EnrollmentService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/students")
@CrossOrigin(origins = "*")
public class StudentController {

    private final EnrollmentService enrollmentService;
    private final StudentRepository studentRepository;
    private final ImageArchive imageArchive;
    private final ImageFetcher imageFetcher;
    private final FaceAttendanceProperties props;

    public StudentController(EnrollmentService enrollmentService,
                             StudentRepository studentRepository,
                             ImageArchive imageArchive,
                             ImageFetcher imageFetcher,
                             FaceAttendanceProperties props) {
        this.enrollmentService = enrollmentService;
        this.studentRepository = studentRepository;
        this.imageArchive = imageArchive;
        this.imageFetcher = imageFetcher;
        this.props = props;
    }

    // Register student from uploaded files and/or image URLs
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<EnrollmentResponse> registerStudent(
            @RequestParam MultiValueMap<String, String> form,
            @RequestParam(value = "images", required = false) List<MultipartFile> files
    ) {
        String studentId = form.getFirst("student_id");
        String appId = form.getFirst("app_id");
        String name = form.getFirst("name");
        if (isBlank(studentId) || isBlank(appId) || isBlank(name)) {
            throw new InputException("student_id, app_id, and name are required");
        }

        List<UploadedImages.Upload> uploads = UploadedImages.read(files);
        List<String> urls = RequestLists.flatten(form.get("image_urls"), "image_urls");

        int expected = props.getEnrollment().getImageCount();
        if (uploads.size() + urls.size() != expected) {
            throw new InputException("Exactly " + expected + " images are required");
        }

        List<ImageInput> downloaded = imageFetcher.fetchAll(urls);

        List<String> archived = new ArrayList<>();
        List<ImageInput> images = new ArrayList<>(expected);
        try {
            for (UploadedImages.Upload upload : uploads) {
                String path = imageArchive.storeEnrollmentImage(studentId.trim(), upload.bytes(), upload.contentType());
                archived.add(path);
                images.add(new ImageInput(path, upload.bytes()));
            }
            images.addAll(downloaded);

            EnrollmentResult result = enrollmentService.enroll(new EnrollmentRequest(studentId, appId, name, images));
            return ResponseEntity.ok(new EnrollmentResponse("Student registered", result));
        } catch (FaceAttendanceException e) {
            imageArchive.discard(archived);
            throw e;
        }
    }

    @GetMapping
    public ResponseEntity<List<Student>> getAllStudents() {
        return ResponseEntity.ok(studentRepository.findAllByOrderByNameAsc());
    }

    @GetMapping("/{studentId}")
    public ResponseEntity<Student> getStudent(@PathVariable String studentId) {
        return studentRepository.findByStudentId(studentId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
