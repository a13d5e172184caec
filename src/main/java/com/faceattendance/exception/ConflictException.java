package com.faceattendance.exception;

/**
 * The student id or app id is already bound to an enrolled student.
 */
public class ConflictException extends FaceAttendanceException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
