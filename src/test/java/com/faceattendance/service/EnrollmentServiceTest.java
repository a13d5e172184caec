package com.faceattendance.service;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.config.ReadinessGate;
import com.faceattendance.exception.ConflictException;
import com.faceattendance.exception.ExtractionException;
import com.faceattendance.exception.InputException;
import com.faceattendance.exception.ServiceNotReadyException;
import com.faceattendance.exception.ValidationException;
import com.faceattendance.face.DetectionMode;
import com.faceattendance.face.FaceExtractionFanOut;
import com.faceattendance.face.StubFaceExtractor;
import com.faceattendance.intake.ImageInput;
import com.faceattendance.model.Student;
import com.faceattendance.repository.StudentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.faceattendance.Vectors.along;
import static com.faceattendance.face.StubFaceExtractor.image;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrollmentServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private StudentRegistrar registrar;

    @Captor
    private ArgumentCaptor<List<EnrolledImage>> enrolledImages;

    private final StubFaceExtractor extractor = new StubFaceExtractor();
    private final FaceAttendanceProperties props = new FaceAttendanceProperties();
    private final ReadinessGate gate = new ReadinessGate();

    private EnrollmentService service;

    private final List<ImageInput> threeImages = List.of(image("a.jpg"), image("b.jpg"), image("c.jpg"));

    @BeforeEach
    void setUp() {
        gate.markReady();
        FaceExtractionFanOut fanOut = new FaceExtractionFanOut(extractor, Runnable::run, props);
        service = new EnrollmentService(studentRepository, fanOut, registrar, gate, props);
    }

    @Test
    void registersStudentWithOneEmbeddingPerPhoto() {
        extractor.withFaces("a.jpg", along(0.0))
                .withFaces("b.jpg", along(0.3))
                .withFaces("c.jpg", along(0.5));
        when(registrar.register(eq("S1"), eq("APP1"), eq("Asha"), anyList()))
                .thenReturn(new Student("S1", "APP1", "Asha"));

        EnrollmentResult result = service.enroll(new EnrollmentRequest(" S1 ", "APP1", "Asha", threeImages));

        assertThat(result.studentId()).isEqualTo("S1");
        assertThat(result.embeddingCount()).isEqualTo(3);
        assertThat(result.maxPairDistance()).isCloseTo(0.5, within(1e-6));
        verify(registrar).register(eq("S1"), eq("APP1"), eq("Asha"), enrolledImages.capture());
        assertThat(enrolledImages.getValue()).extracting(EnrolledImage::sourceRef)
                .containsExactly("a.jpg", "b.jpg", "c.jpg");
        assertThat(extractor.modes()).containsOnly(DetectionMode.SINGLE);
    }

    @Test
    void requiresExactlyThePhotoCount() {
        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages.subList(0, 2))))
                .isInstanceOf(InputException.class)
                .hasMessage("Exactly 3 images are required");

        List<ImageInput> four = List.of(image("a.jpg"), image("b.jpg"), image("c.jpg"), image("d.jpg"));
        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", four)))
                .isInstanceOf(InputException.class);
        assertThat(extractor.calls()).isZero();
    }

    @Test
    void requiresIdentityFields() {
        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", " ", "Asha", threeImages)))
                .isInstanceOf(InputException.class)
                .hasMessage("app_id is required");
    }

    @Test
    void rejectsAlreadyEnrolledStudentBeforeExtraction() {
        when(studentRepository.existsByStudentIdOrAppId("S1", "APP1")).thenReturn(true);

        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOf(ConflictException.class);
        assertThat(extractor.calls()).isZero();
        verifyNoInteractions(registrar);
    }

    @Test
    void photoWithoutFaceIsReportedWithItsIndex() {
        extractor.withFaces("a.jpg", along(0.0))
                .withFaces("c.jpg", along(0.1));

        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e).hasMessage("No face detected in image 2");
                    assertThat(e.getImageIndex()).hasValue(1);
                });
        verifyNoInteractions(registrar);
    }

    @Test
    void photosOfDifferentPeopleAreRejected() {
        extractor.withFaces("a.jpg", along(0.0))
                .withFaces("b.jpg", along(0.0))
                .withFaces("c.jpg", along(0.75));

        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Images are not of the same person");
        verifyNoInteractions(registrar);
    }

    @Test
    void everyPairOfPhotosMustBeClose() {
        // each photo is within 0.5 of the first, but the second and third are 1.0 apart
        extractor.withFaces("a.jpg", along(0.0))
                .withFaces("b.jpg", along(0.5))
                .withFaces("c.jpg", along(-0.5));

        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void strictModeRejectsGroupPhotos() {
        props.getEnrollment().setRequireSingleFace(true);
        extractor.withFaces("a.jpg", along(0.0))
                .withFaces("b.jpg", along(0.1), along(4.0))
                .withFaces("c.jpg", along(0.2));

        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e).hasMessage("Multiple faces detected in image 2");
                    assertThat(e.getImageIndex()).hasValue(1);
                });
        assertThat(extractor.modes()).containsOnly(DetectionMode.ALL);
    }

    @Test
    void defaultModeUsesTheMostConfidentFace() {
        extractor.withFaces("a.jpg", along(0.0))
                .withFaces("b.jpg", along(0.1), along(4.0))
                .withFaces("c.jpg", along(0.2));
        when(registrar.register(any(), any(), any(), anyList())).thenReturn(new Student("S1", "APP1", "Asha"));

        EnrollmentResult result = service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages));

        assertThat(result.maxPairDistance()).isLessThan(0.6);
    }

    @Test
    void extractionFailureStopsEnrollment() {
        extractor.withFaces("a.jpg", along(0.0))
                .failingOn("b.jpg", new ExtractionException("corrupt image"))
                .withFaces("c.jpg", along(0.1));

        assertThatThrownBy(() -> service.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOfSatisfying(ExtractionException.class,
                        e -> assertThat(e.getImageIndex()).hasValue(1));
        verifyNoInteractions(registrar);
    }

    @Test
    void refusesWorkUntilReady() {
        ReadinessGate closed = new ReadinessGate();
        EnrollmentService notReady = new EnrollmentService(studentRepository,
                new FaceExtractionFanOut(extractor, Runnable::run, props), registrar, closed, props);

        assertThatThrownBy(() -> notReady.enroll(new EnrollmentRequest("S1", "APP1", "Asha", threeImages)))
                .isInstanceOf(ServiceNotReadyException.class);
        verifyNoInteractions(studentRepository, registrar);
    }

    @Test
    void maxPairDistanceOfSinglePhotoIsZero() {
        assertThat(EnrollmentService.maxPairDistance(List.of(new EnrolledImage("a.jpg", along(1.0)))))
                .isZero();
    }
}
