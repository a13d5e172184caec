package com.faceattendance.exception;

/**
 * Malformed or missing request data. The caller has to fix the input; never retried.
 */
public class InputException extends FaceAttendanceException {

    public InputException(String message) {
        super(message);
    }
}
