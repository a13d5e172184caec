package com.faceattendance.exception;

/**
 * Persistence failure. Enrollment propagates it to the caller; background
 * reconciliation logs it and aborts the run.
 */
public class StoreException extends FaceAttendanceException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
