package com.faceattendance.exception;

public class ServiceNotReadyException extends FaceAttendanceException {

    public ServiceNotReadyException(String message) {
        super(message);
    }
}
