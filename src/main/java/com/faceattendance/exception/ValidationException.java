package com.faceattendance.exception;

import java.util.OptionalInt;

/**
 * Enrollment photos were rejected: no face, several faces, or not the same person.
 * Terminal for the attempt; nothing has been persisted when this is thrown.
 */
public class ValidationException extends FaceAttendanceException {

    private final Integer imageIndex;

    public ValidationException(String message) {
        super(message);
        this.imageIndex = null;
    }

    public ValidationException(String message, int imageIndex) {
        super(message);
        this.imageIndex = imageIndex;
    }

    public OptionalInt getImageIndex() {
        return imageIndex == null ? OptionalInt.empty() : OptionalInt.of(imageIndex);
    }
}
