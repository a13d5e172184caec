package com.faceattendance.exception;

/**
 * Root of every failure raised by the enrollment and attendance pipeline.
 */
public class FaceAttendanceException extends RuntimeException {

    public FaceAttendanceException(String message) {
        super(message);
    }

    public FaceAttendanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
