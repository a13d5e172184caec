package com.faceattendance.controller;

import com.faceattendance.exception.ServiceNotReadyException;
import com.faceattendance.intake.ImageFetcher;
import com.faceattendance.intake.ImageInput;
import com.faceattendance.model.AttendanceRecordView;
import com.faceattendance.model.AttendanceStatus;
import com.faceattendance.repository.AttendanceMarkRepository;
import com.faceattendance.service.AttendanceJobRunner;
import com.faceattendance.service.AttendanceOutcome;
import com.faceattendance.service.AttendanceReconciler;
import com.faceattendance.service.JobAcknowledgement;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;

import java.util.List;
import java.util.TreeSet;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AttendanceController.class)
@Import(ControllerTestConfig.class)
class AttendanceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AttendanceReconciler reconciler;

    @MockBean
    private AttendanceJobRunner jobRunner;

    @MockBean
    private ImageFetcher imageFetcher;

    @MockBean
    private AttendanceMarkRepository markRepository;

    private static AttendanceOutcome outcome(List<String> present, List<String> absent) {
        return new AttendanceOutcome("TT1", new TreeSet<>(present), new TreeSet<>(absent), 4, 1, 0);
    }

    private static MockMultipartFile photo(String name) {
        return new MockMultipartFile("images", name, "image/png", new byte[]{1});
    }

    @Test
    void processesUploadedClassPhotos() throws Exception {
        when(reconciler.reconcile(eq("TT1"), eq(List.of("S1", "S2", "S3")), anyList()))
                .thenReturn(outcome(List.of("S1", "S3"), List.of("S2")));

        mockMvc.perform(multipart("/class/attendance")
                        .file(photo("front.png"))
                        .file(photo("back.png"))
                        .param("timetable_id", "TT1")
                        .param("student_ids", "[\"S1\", \"S2\"]", "S3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timetable_id").value("TT1"))
                .andExpect(jsonPath("$.presentCount").value(2))
                .andExpect(jsonPath("$.absent[0]").value("S2"))
                .andExpect(jsonPath("$.detections").value(4));
    }

    @Test
    void tooManyPhotosAreRejected() throws Exception {
        MockMultipartHttpServletRequestBuilder request = multipart("/class/attendance");
        for (int i = 0; i < 6; i++) {
            request.file(photo("p" + i + ".png"));
        }

        mockMvc.perform(request.param("timetable_id", "TT1").param("student_ids", "S1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At most 5 images are allowed"));
        verifyNoInteractions(reconciler);
    }

    @Test
    void classPhotosRequireRoster() throws Exception {
        mockMvc.perform(multipart("/class/attendance")
                        .file(photo("front.png"))
                        .param("timetable_id", "TT1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("timetable_id, student_ids, and images required"));
    }

    @Test
    void urlAttendanceAnswersWithTheResult() throws Exception {
        List<ImageInput> images = List.of(new ImageInput("http://cdn.test/1.jpg", new byte[]{1}));
        when(imageFetcher.fetchAvailable(List.of("http://cdn.test/1.jpg", "http://cdn.test/2.jpg")))
                .thenReturn(images);
        when(reconciler.reconcile("TT1", List.of("S1", "S2"), images))
                .thenReturn(outcome(List.of("S1"), List.of("S2")));

        mockMvc.perform(post("/class/attendance-url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"timetable_id": "TT1", "student_ids": ["S1", "S2"],
                                 "image_urls": ["http://cdn.test/1.jpg", "http://cdn.test/2.jpg"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Attendance processed via URLs"))
                .andExpect(jsonPath("$.present[0]").value("S1"));
    }

    @Test
    void urlAttendanceFailsWhenNothingDownloads() throws Exception {
        when(imageFetcher.fetchAvailable(anyList())).thenReturn(List.of());

        mockMvc.perform(post("/class/attendance-url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timetable_id\": \"TT1\", \"student_ids\": \"S1\", \"image_urls\": \"http://cdn.test/1.jpg\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("None of the images could be downloaded"));
        verifyNoInteractions(reconciler);
    }

    @Test
    void backgroundRequestIsAcknowledged() throws Exception {
        when(jobRunner.submit("TT1", List.of("S1", "S2"), List.of("http://cdn.test/1.jpg")))
                .thenReturn(new JobAcknowledgement("Attendance request received. Processing in background.",
                        "TT1", 2, 1));

        mockMvc.perform(post("/api/attendance-by-url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timetable_id\": \"TT1\", \"student_ids\": [\"S1\", \"S2\"], \"image_urls\": \"http://cdn.test/1.jpg\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timetable_id").value("TT1"))
                .andExpect(jsonPath("$.studentCount").value(2))
                .andExpect(jsonPath("$.imageCount").value(1));
        verifyNoInteractions(reconciler);
    }

    @Test
    void saturatedJobQueueIsUnavailable() throws Exception {
        when(jobRunner.submit(any(), anyList(), anyList())).thenThrow(new TaskRejectedException("queue full"));

        mockMvc.perform(post("/api/attendance-by-url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timetable_id\": \"TT1\", \"student_ids\": [\"S1\"], \"image_urls\": [\"http://cdn.test/1.jpg\"]}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void notReadyIsUnavailable() throws Exception {
        when(reconciler.reconcile(any(), any(), anyList())).thenThrow(new ServiceNotReadyException("starting"));

        mockMvc.perform(multipart("/class/attendance")
                        .file(photo("front.png"))
                        .param("timetable_id", "TT1")
                        .param("student_ids", "S1"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void malformedJsonIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/attendance-by-url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timetable_id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void readsSessionRecords() throws Exception {
        when(markRepository.findRecordsForSession("TT1")).thenReturn(List.of(
                new AttendanceRecordView(1L, AttendanceStatus.PRESENT, 10L, "Asha", "S1", "APP1")));

        mockMvc.perform(get("/attendance").param("timetable_id", "TT1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].status").value("Present"))
                .andExpect(jsonPath("$.records[0].studentId").value("S1"));
        mockMvc.perform(get("/attendance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("timetable_id required"));
        verify(markRepository).findRecordsForSession("TT1");
    }
}
