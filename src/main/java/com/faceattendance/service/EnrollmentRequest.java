package com.faceattendance.service;

import com.faceattendance.intake.ImageInput;

import java.util.List;

public record EnrollmentRequest(String studentId, String appId, String name, List<ImageInput> images) {

    public EnrollmentRequest {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
