package com.faceattendance.service;

public record EnrolledImage(String sourceRef, float[] descriptor) {
}
