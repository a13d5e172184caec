package com.faceattendance.face;

import com.faceattendance.exception.ExtractionException;

import java.util.List;

public record ExtractionOutcome(int index,
                                String sourceRef,
                                List<DetectedFace> faces,
                                ExtractionException failure) {

    public static ExtractionOutcome success(int index, String sourceRef, List<DetectedFace> faces) {
        return new ExtractionOutcome(index, sourceRef, List.copyOf(faces), null);
    }

    public static ExtractionOutcome failure(int index, String sourceRef, ExtractionException failure) {
        return new ExtractionOutcome(index, sourceRef, List.of(), failure);
    }

    public boolean failed() {
        return failure != null;
    }
}
