package com.faceattendance.service;

public record EnrollmentResult(Long id,
                               String studentId,
                               String appId,
                               String name,
                               int embeddingCount,
                               double maxPairDistance) {
}
