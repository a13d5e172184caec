package com.faceattendance.exception;

import java.util.OptionalInt;

/**
 * The face embedding service could not produce a usable result for an image.
 */
public class ExtractionException extends FaceAttendanceException {

    private final Integer imageIndex;

    public ExtractionException(String message) {
        this(message, null, null);
    }

    public ExtractionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    private ExtractionException(String message, Integer imageIndex, Throwable cause) {
        super(message, cause);
        this.imageIndex = imageIndex;
    }

    /** Same failure, tagged with the position of the image in its request. */
    public ExtractionException atImage(int index) {
        return new ExtractionException(getMessage(), index, getCause() == null ? this : getCause());
    }

    public OptionalInt getImageIndex() {
        return imageIndex == null ? OptionalInt.empty() : OptionalInt.of(imageIndex);
    }
}
