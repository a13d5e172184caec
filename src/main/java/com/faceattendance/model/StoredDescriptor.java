package com.faceattendance.model;

public record StoredDescriptor(String studentId, String faceDescriptor) {
}
