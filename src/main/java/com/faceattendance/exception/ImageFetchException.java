package com.faceattendance.exception;

public class ImageFetchException extends FaceAttendanceException {

    public ImageFetchException(String message) {
        super(message);
    }

    public ImageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
