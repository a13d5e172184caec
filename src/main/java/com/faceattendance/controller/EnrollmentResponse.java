package com.faceattendance.controller;

import com.faceattendance.service.EnrollmentResult;

public record EnrollmentResponse(String message, EnrollmentResult student) {
}
